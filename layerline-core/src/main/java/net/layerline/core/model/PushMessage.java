package net.layerline.core.model;

public record PushMessage(String jobId, JobStatus status, String summary) {}
