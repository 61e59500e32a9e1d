package com.brandish.progression.tree;

public record TreeSyncResult(
        int inserted,
        int updated,
        int skipped,
        int autoUnlocked,
        boolean unchanged
) {
    public static TreeSyncResult unchangedFile() {
        return new TreeSyncResult(0, 0, 0, 0, true);
    }
}
