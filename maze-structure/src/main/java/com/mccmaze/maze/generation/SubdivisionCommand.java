package com.mccmaze.maze.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One decoded wall gene: which pending room to split, where its wall and
 * passage go, and the orientation to use if the room is square.
 *
 * Positions are normalized to [0, 1].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubdivisionCommand {

    @JsonProperty("roomIndex")
    private int roomIndex;

    @JsonProperty("unscaledWallPosition")
    private double unscaledWallPosition;

    @JsonProperty("unscaledPassagePosition")
    private double unscaledPassagePosition;

    @JsonProperty("orientationSeed")
    private boolean orientationSeed;

    /**
     * Default constructor for Jackson.
     */
    public SubdivisionCommand() {
    }

    public SubdivisionCommand(int roomIndex, double unscaledWallPosition, double unscaledPassagePosition,
                              boolean orientationSeed) {
        this.roomIndex = roomIndex;
        this.unscaledWallPosition = unscaledWallPosition;
        this.unscaledPassagePosition = unscaledPassagePosition;
        this.orientationSeed = orientationSeed;
    }

    /**
     * Command that always splits the oldest pending room.
     */
    public SubdivisionCommand(double unscaledWallPosition, double unscaledPassagePosition, boolean orientationSeed) {
        this(0, unscaledWallPosition, unscaledPassagePosition, orientationSeed);
    }

    // Getters and setters
    public int getRoomIndex() { return roomIndex; }
    public void setRoomIndex(int roomIndex) { this.roomIndex = roomIndex; }

    public double getUnscaledWallPosition() { return unscaledWallPosition; }
    public void setUnscaledWallPosition(double unscaledWallPosition) { this.unscaledWallPosition = unscaledWallPosition; }

    public double getUnscaledPassagePosition() { return unscaledPassagePosition; }
    public void setUnscaledPassagePosition(double unscaledPassagePosition) { this.unscaledPassagePosition = unscaledPassagePosition; }

    public boolean isOrientationSeed() { return orientationSeed; }
    public void setOrientationSeed(boolean orientationSeed) { this.orientationSeed = orientationSeed; }

    @Override
    public String toString() {
        return String.format("SubdivisionCommand[room=%d, wall=%.4f, passage=%.4f, horizontal=%b]",
                roomIndex, unscaledWallPosition, unscaledPassagePosition, orientationSeed);
    }
}
