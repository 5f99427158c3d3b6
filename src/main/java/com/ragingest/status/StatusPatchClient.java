package com.ragingest.status;

import java.io.IOException;

@FunctionalInterface
public interface StatusPatchClient {
    void patch(JobStatus status) throws IOException;
}
