package com.coderocket.model;

/**
 * Content of one file submitted for review, or the reason it could not be read.
 */
public record FileContent(String path, String content, String error) {

    public static FileContent of(String path, String content) {
        return new FileContent(path, content, null);
    }

    public static FileContent error(String path, String error) {
        return new FileContent(path, "", error);
    }

    public boolean hasError() {
        return error != null;
    }
}
