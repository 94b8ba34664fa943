package com.mccmaze.maze.generation;

import com.mccmaze.maze.structure.MazeGrid;
import com.mccmaze.maze.structure.MazeRoom;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the cells not covered by a laid solution path into rectangular
 * sub-mazes.
 *
 * Rectangles are grown greedily in row-major order: from the first uncovered
 * cell, extend east as far as possible, then extend that strip south while
 * every cell below it is still uncovered.
 */
public final class SubmazeExtractor {

    private SubmazeExtractor() {
    }

    public static List<MazeRoom> extractSubmazes(MazeGrid grid) {
        int width = grid.getWidth();
        int height = grid.getHeight();
        boolean[][] covered = new boolean[height][width];

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                covered[row][col] = grid.getCell(col, row).isOnPath();
            }
        }

        List<MazeRoom> submazes = new ArrayList<>();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                if (covered[row][col]) {
                    continue;
                }

                int endCol = col;
                while (endCol + 1 < width && !covered[row][endCol + 1]) {
                    endCol++;
                }

                int endRow = row;
                while (endRow + 1 < height && isRowSpanFree(covered, endRow + 1, col, endCol)) {
                    endRow++;
                }

                for (int r = row; r <= endRow; r++) {
                    for (int c = col; c <= endCol; c++) {
                        covered[r][c] = true;
                    }
                }
                submazes.add(new MazeRoom(col, row, endCol - col + 1, endRow - row + 1));
            }
        }

        return submazes;
    }

    private static boolean isRowSpanFree(boolean[][] covered, int row, int startCol, int endCol) {
        for (int col = startCol; col <= endCol; col++) {
            if (covered[row][col]) {
                return false;
            }
        }
        return true;
    }
}
