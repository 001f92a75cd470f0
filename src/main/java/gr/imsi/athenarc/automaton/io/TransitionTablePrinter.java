package gr.imsi.athenarc.automaton.io;

import java.io.PrintStream;

import com.google.common.base.Strings;

/**
 * Pretty-prints a grid of cells, e.g. the transition table of an automaton.
 */
public class TransitionTablePrinter {

    private static final String HORIZONTAL_BORDER_KNOT = "+";
    private static final String HORIZONTAL_BORDER_PATTERN = "-";
    private static final String VERTICAL_BORDER_PATTERN = "|";

    private TransitionTablePrinter() {
    }

    public static void print(String[][] matrix, PrintStream out) {
        out.print(format(matrix));
    }

    /**
     * Renders the grid with every cell left-padded to the widest cell.
     * An empty grid renders as an empty string.
     */
    public static String format(String[][] matrix) {
        if (matrix.length == 0) {
            return "";
        }
        int numberOfColumns = 0;
        int maxColumnWidth = 0;
        for (String[] row : matrix) {
            numberOfColumns = Math.max(numberOfColumns, row.length);
            for (String cell : row) {
                maxColumnWidth = Math.max(maxColumnWidth, cell.length());
            }
        }
        String horizontalBorder = createHorizontalBorder(numberOfColumns, maxColumnWidth);
        StringBuilder sb = new StringBuilder();
        sb.append(horizontalBorder).append(System.lineSeparator());
        for (String[] row : matrix) {
            sb.append(VERTICAL_BORDER_PATTERN);
            for (String cell : row) {
                sb.append(Strings.padStart(cell, maxColumnWidth, ' ')).append(VERTICAL_BORDER_PATTERN);
            }
            sb.append(System.lineSeparator());
            sb.append(horizontalBorder).append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static String createHorizontalBorder(int numberOfColumns, int width) {
        return HORIZONTAL_BORDER_KNOT
            + Strings.repeat(Strings.repeat(HORIZONTAL_BORDER_PATTERN, width) + HORIZONTAL_BORDER_KNOT, numberOfColumns);
    }
}
