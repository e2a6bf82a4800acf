package net.layerline.core.poll;

@FunctionalInterface
public interface StatusSource {
    ProviderStatus fetch(String providerJobId) throws Exception;
}
