package com.github.stormino.streamcore.util;

import lombok.experimental.UtilityClass;

/**
 * Binary size conversions and formatting used by memory snapshots and log lines.
 */
@UtilityClass
public class ByteUnits {

    /**
     * Bytes in one kibibyte.
     */
    public static final long BYTES_PER_KIB = 1024L;

    /**
     * Bytes in one mebibyte. Memory thresholds are expressed in this unit.
     */
    public static final long BYTES_PER_MIB = 1024L * 1024;

    /**
     * Bytes in one gibibyte.
     */
    public static final long BYTES_PER_GIB = 1024L * 1024 * 1024;

    /**
     * Convert bytes to mebibytes.
     *
     * @param bytes Size in bytes
     * @return Size in MiB
     */
    public static double toMegabytes(long bytes) {
        return bytes / (double) BYTES_PER_MIB;
    }

    /**
     * Convert mebibytes to bytes, truncating any fraction of a byte.
     *
     * @param megabytes Size in MiB
     * @return Size in bytes
     */
    public static long fromMegabytes(double megabytes) {
        return (long) (megabytes * BYTES_PER_MIB);
    }

    /**
     * Format bytes to a human-readable binary size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.50 GiB", "512.00 MiB", "3.25 KiB" or "12 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= BYTES_PER_GIB) {
            return String.format("%.2f GiB", bytes / (double) BYTES_PER_GIB);
        } else if (bytes >= BYTES_PER_MIB) {
            return String.format("%.2f MiB", bytes / (double) BYTES_PER_MIB);
        } else if (bytes >= BYTES_PER_KIB) {
            return String.format("%.2f KiB", bytes / (double) BYTES_PER_KIB);
        } else {
            return String.format("%d B", bytes);
        }
    }
}
