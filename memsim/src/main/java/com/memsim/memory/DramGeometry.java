package com.memsim.memory;

/**
 * Physical organisation of the DRAM behind the controller:
 * channels x ranks x banks x rows x columns, one byte per column.
 */
public final class DramGeometry {
    private final int channels;
    private final int ranksPerChannel;
    private final int banksPerRank;
    private final int rowsPerBank;
    private final int colsPerRow;

    public DramGeometry(int channels, int ranksPerChannel, int banksPerRank, int rowsPerBank, int colsPerRow) {
        requirePositive("channels", channels);
        requirePositive("ranksPerChannel", ranksPerChannel);
        requirePositive("banksPerRank", banksPerRank);
        requirePositive("rowsPerBank", rowsPerBank);
        requirePositive("colsPerRow", colsPerRow);
        this.channels = channels;
        this.ranksPerChannel = ranksPerChannel;
        this.banksPerRank = banksPerRank;
        this.rowsPerBank = rowsPerBank;
        this.colsPerRow = colsPerRow;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0)
            throw new InvalidConfigurationException(name + " must be positive (got " + value + ")");
    }

    public int getChannels() {
        return channels;
    }

    public int getRanksPerChannel() {
        return ranksPerChannel;
    }

    public int getBanksPerRank() {
        return banksPerRank;
    }

    public int getRowsPerBank() {
        return rowsPerBank;
    }

    public int getColsPerRow() {
        return colsPerRow;
    }

    /** Total number of banks across all channels and ranks. */
    public int getTotalBanks() {
        return channels * ranksPerChannel * banksPerRank;
    }

    /** Addressable bytes: channels * ranks * banks * rows * cols. */
    public long getPhysicalSize() {
        return (long) channels * ranksPerChannel * banksPerRank * rowsPerBank * colsPerRow;
    }

    @Override
    public String toString() {
        return String.format("Channels=%d, Ranks=%d, BanksPerRank=%d, RowsPerBank=%d, ColsPerRow=%d",
                channels, ranksPerChannel, banksPerRank, rowsPerBank, colsPerRow);
    }
}
