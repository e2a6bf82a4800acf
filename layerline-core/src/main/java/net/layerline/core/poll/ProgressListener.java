package net.layerline.core.poll;

@FunctionalInterface
public interface ProgressListener {
    void onProgress(int percent, String statusText);

    ProgressListener NONE = (percent, statusText) -> {};
}
