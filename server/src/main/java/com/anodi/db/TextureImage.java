package com.anodi.db;

public class TextureImage {
    private final long id;
    private final String contentHash;
    private final int height;
    private final int width;
    private final long createdTs;

    public TextureImage(long id, String contentHash, int height, int width, long createdTs) {
        this.id = id;
        this.contentHash = contentHash;
        this.height = height;
        this.width = width;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getContentHash() {
        return contentHash;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "TextureImage{id=" + id + ", hash='" + contentHash + "', " + height + "x" + width + "}";
    }
}
