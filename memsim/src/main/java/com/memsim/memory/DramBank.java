package com.memsim.memory;

import java.util.Arrays;

/**
 * One DRAM bank: rows x columns of bytes plus the row buffer.
 * Reads and writes only reach the currently open row; callers (the
 * controller) must activate / precharge first.
 */
public class DramBank {
    public static final int NO_OPEN_ROW = -1;

    private final byte[][] rows; // rows[row][col]
    private final int rowCount;
    private final int colCount;
    private int openRow = NO_OPEN_ROW;

    public DramBank(int rowCount, int colCount) {
        if (rowCount <= 0 || colCount <= 0)
            throw new InvalidConfigurationException("Bank needs positive rows/cols (" + rowCount + "x" + colCount + ")");
        this.rowCount = rowCount;
        this.colCount = colCount;
        this.rows = new byte[rowCount][colCount];
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColCount() {
        return colCount;
    }

    public boolean hasOpenRow() {
        return openRow != NO_OPEN_ROW;
    }

    /** Open row index or {@link #NO_OPEN_ROW}. */
    public int getOpenRow() {
        return openRow;
    }

    /** Bring a row into the row buffer. */
    public void activate(int row) {
        if (row < 0 || row >= rowCount)
            throw new OutOfBoundsException(row, 1, "Row " + row + " outside bank (rows=" + rowCount + ")");
        openRow = row;
    }

    /** Close the open row (no-op when already closed). */
    public void precharge() {
        openRow = NO_OPEN_ROW;
    }

    public byte[] readOpenRow(int col, int len) {
        requireOpen();
        checkColumns(col, len);
        return Arrays.copyOfRange(rows[openRow], col, col + len);
    }

    public void writeOpenRow(int col, byte[] data) {
        requireOpen();
        checkColumns(col, data.length);
        System.arraycopy(data, 0, rows[openRow], col, data.length);
    }

    /** Copy-out read that ignores the row buffer (introspection only). */
    public byte[] peek(int row, int col, int len) {
        if (row < 0 || row >= rowCount)
            throw new OutOfBoundsException(row, len, "Row " + row + " outside bank (rows=" + rowCount + ")");
        checkColumns(col, len);
        return Arrays.copyOfRange(rows[row], col, col + len);
    }

    /** True if len bytes starting at col fit inside one row. */
    public boolean fits(int col, int len) {
        return col >= 0 && len >= 0 && (long) col + len <= colCount;
    }

    /** Close the row buffer and zero every row. */
    public void clear() {
        openRow = NO_OPEN_ROW;
        for (byte[] r : rows)
            Arrays.fill(r, (byte) 0);
    }

    private void requireOpen() {
        if (openRow == NO_OPEN_ROW)
            throw new IllegalStateException("No open row");
    }

    private void checkColumns(int col, int len) {
        if (!fits(col, len))
            throw new OutOfBoundsException(col, len,
                    "Column range [" + col + ", " + ((long) col + len) + ") exceeds row width " + colCount);
    }
}
