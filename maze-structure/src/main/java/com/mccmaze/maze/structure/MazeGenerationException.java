package com.mccmaze.maze.structure;

/**
 * Raised when maze generation or analysis meets an inconsistent grid or
 * out-of-range input, such as an unreachable target or a room with
 * non-positive dimensions. These indicate a malformed genome decoding and
 * are never recovered from.
 */
public class MazeGenerationException extends RuntimeException {

    public MazeGenerationException(String message) {
        super(message);
    }

    public MazeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
