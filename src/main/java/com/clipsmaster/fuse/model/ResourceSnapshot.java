package com.clipsmaster.fuse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 资源状态快照。独立于资源句柄保存，用于熔断过后的回滚恢复。
 */
public class ResourceSnapshot {

    private final String resourceId;
    private final String resourceType;
    private final Map<String, Object> metadata;
    private final List<String> dependencyIds;
    private final long creationTimestamp;

    @JsonCreator
    public ResourceSnapshot(@JsonProperty("resource_id") String resourceId,
                            @JsonProperty("resource_type") String resourceType,
                            @JsonProperty("metadata") Map<String, Object> metadata,
                            @JsonProperty("dependency_ids") List<String> dependencyIds,
                            @JsonProperty("creation_timestamp") long creationTimestamp) {
        this.resourceId = resourceId;
        this.resourceType = resourceType;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.dependencyIds = dependencyIds != null ? List.copyOf(dependencyIds) : Collections.emptyList();
        this.creationTimestamp = creationTimestamp;
    }

    @JsonProperty("resource_id")
    public String getResourceId() { return resourceId; }

    @JsonProperty("resource_type")
    public String getResourceType() { return resourceType; }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    @JsonProperty("dependency_ids")
    public List<String> getDependencyIds() { return dependencyIds; }

    @JsonProperty("creation_timestamp")
    public long getCreationTimestamp() { return creationTimestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceSnapshot)) return false;
        ResourceSnapshot that = (ResourceSnapshot) o;
        return creationTimestamp == that.creationTimestamp
                && Objects.equals(resourceId, that.resourceId)
                && Objects.equals(resourceType, that.resourceType)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(dependencyIds, that.dependencyIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceId, resourceType, metadata, dependencyIds, creationTimestamp);
    }

    @Override
    public String toString() {
        return "ResourceSnapshot{" + resourceId + ", type=" + resourceType + ", deps=" + dependencyIds + "}";
    }
}
