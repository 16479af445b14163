package edu.stanford.futuredata.crashserve.utilities;

import org.javatuples.Pair;

public class Utilities {

    // Inbound message limit on coordinator and client channels.  Result pages stay far below it.
    public static final int MAX_INBOUND_MESSAGE_BYTES = 64 * 1024 * 1024;

    public static Pair<String, Integer> parseConnectString(String connectString) {
        int split = connectString.lastIndexOf(':');
        if (split <= 0 || split == connectString.length() - 1) {
            throw new IllegalArgumentException("Expected host:port, got " + connectString);
        }
        String host = connectString.substring(0, split);
        Integer port = Integer.parseInt(connectString.substring(split + 1));
        return new Pair<>(host, port);
    }

    public static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    // Space-separated hex of at most maxBytes leading bytes.
    public static String hexPreview(byte[] data, int maxBytes) {
        StringBuilder sb = new StringBuilder();
        int n = Math.min(data.length, maxBytes);
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02x", data[i] & 0xff));
        }
        return sb.toString();
    }
}
