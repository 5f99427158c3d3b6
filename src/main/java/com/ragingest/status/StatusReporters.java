package com.ragingest.status;

import java.nio.file.Path;
import java.util.Map;

import com.ragingest.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class StatusReporters {
    private StatusReporters() {
    }

    public static StatusReporter fromConfig(AppConfig.StatusConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        Path statusFile = config.getFilePath().isBlank() ? null : Path.of(config.getFilePath());
        StatusPatchClient patchClient = null;
        if (config.isUseKubernetesApi()) {
            patchClient = KubernetesStatusPatchClient.inCluster(httpClient, config.getNamespace(), environment).orElse(null);
        }
        return new JobStatusReporter(statusFile, patchClient);
    }
}
