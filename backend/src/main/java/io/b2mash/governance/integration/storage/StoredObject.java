package io.b2mash.governance.integration.storage;

public record StoredObject(String bucket, String key) {}
