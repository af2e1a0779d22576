package io.chimera.core.memory;

public record MemoryScope(String workspaceId) {

    public static MemoryScope all() {
        return new MemoryScope(null);
    }

    public static MemoryScope workspace(String workspaceId) {
        return new MemoryScope(workspaceId);
    }

    public boolean includes(String candidateWorkspaceId) {
        return workspaceId == null || workspaceId.isBlank() || workspaceId.equals(candidateWorkspaceId);
    }
}
