package com.coderocket.source;

import java.io.IOException;

/**
 * A git command could not be run or exited with an error.
 */
public class GitException extends IOException {

    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
