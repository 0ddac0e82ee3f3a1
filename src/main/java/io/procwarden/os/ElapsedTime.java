package io.procwarden.os;

public final class ElapsedTime {
    private ElapsedTime() {
    }

    public static long parseMillis(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        String[] parts = raw.trim().split("[-:]");
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Long.parseLong(parts[i].trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
            if (values[i] < 0) {
                return 0L;
            }
        }
        long seconds;
        switch (values.length) {
            case 1 -> seconds = values[0];
            case 2 -> seconds = values[0] * 60L + values[1];
            case 3 -> seconds = values[0] * 3_600L + values[1] * 60L + values[2];
            case 4 -> {
                if (!raw.contains("-")) {
                    return 0L;
                }
                seconds = values[0] * 86_400L + values[1] * 3_600L + values[2] * 60L + values[3];
            }
            default -> {
                return 0L;
            }
        }
        return seconds * 1_000L;
    }
}
