package com.ragingest.status;

public record JobProgress(long total, long processed, int percentage) {
    public static final JobProgress NONE = new JobProgress(0, 0, 0);

    public static JobProgress of(long total, long processed) {
        int percentage = total <= 0 ? 0 : (int) (processed * 100 / total);
        return new JobProgress(total, processed, percentage);
    }
}
