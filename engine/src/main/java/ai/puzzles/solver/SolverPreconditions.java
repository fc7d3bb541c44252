package ai.puzzles.solver;

import ai.puzzles.game.Board;

final class SolverPreconditions {
    private SolverPreconditions() {
    }

    static void requireSameSize(Board start, Board goal) {
        if (start == null || goal == null) {
            throw new IllegalArgumentException("Start and goal boards are required");
        }
        if (start.getSize() != goal.getSize()) {
            throw new IllegalArgumentException("Start board is " + start.getSize() + "x" + start.getSize()
                    + " but goal is " + goal.getSize() + "x" + goal.getSize());
        }
    }
}
