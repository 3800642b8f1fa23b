package com.memsim.memory;

/** Decoded DRAM coordinates of a physical address. */
public final class DramAddress {
    private final int channel;
    private final int rank;
    private final int bank;
    private final int row;
    private final int column;

    public DramAddress(int channel, int rank, int bank, int row, int column) {
        this.channel = channel;
        this.rank = rank;
        this.bank = bank;
        this.row = row;
        this.column = column;
    }

    public int getChannel() {
        return channel;
    }

    public int getRank() {
        return rank;
    }

    public int getBank() {
        return bank;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DramAddress))
            return false;
        DramAddress other = (DramAddress) o;
        return channel == other.channel && rank == other.rank && bank == other.bank && row == other.row
                && column == other.column;
    }

    @Override
    public int hashCode() {
        int h = channel;
        h = 31 * h + rank;
        h = 31 * h + bank;
        h = 31 * h + row;
        h = 31 * h + column;
        return h;
    }

    @Override
    public String toString() {
        return String.format("ch=%d rk=%d bk=%d row=%d col=%d", channel, rank, bank, row, column);
    }
}
