package com.ragingest.status;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class KubernetesStatusPatchClient implements StatusPatchClient {
    private static final Logger log = LoggerFactory.getLogger(KubernetesStatusPatchClient.class);
    private static final MediaType MERGE_PATCH = MediaType.parse("application/merge-patch+json");
    private static final String API_GROUP = "rag.ai";
    private static final String API_VERSION = "v1alpha1";
    private static final Path SERVICE_ACCOUNT = Path.of("/var/run/secrets/kubernetes.io/serviceaccount");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiServer;
    private final String token;
    private final String namespace;

    public KubernetesStatusPatchClient(OkHttpClient httpClient, String apiServer, String token, String namespace) {
        this.httpClient = httpClient;
        this.apiServer = apiServer.endsWith("/") ? apiServer.substring(0, apiServer.length() - 1) : apiServer;
        this.token = token;
        this.namespace = namespace;
    }

    public static Optional<StatusPatchClient> inCluster(OkHttpClient httpClient, String namespace, Map<String, String> environment) {
        String host = environment.get("KUBERNETES_SERVICE_HOST");
        String port = environment.getOrDefault("KUBERNETES_SERVICE_PORT", "443");
        Path tokenFile = SERVICE_ACCOUNT.resolve("token");
        if (host == null || host.isBlank() || !Files.isReadable(tokenFile)) {
            log.warn("Kubernetes status updates requested but no in-cluster service account was found");
            return Optional.empty();
        }
        try {
            String token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
            OkHttpClient clusterClient = trustClusterCa(httpClient, SERVICE_ACCOUNT.resolve("ca.crt"));
            String server = "https://" + (host.contains(":") ? "[" + host + "]" : host) + ":" + port;
            log.info("Kubernetes status updates enabled server={} namespace={}", server, namespace);
            return Optional.of(new KubernetesStatusPatchClient(clusterClient, server, token, namespace));
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Kubernetes status updates disabled cause={}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void patch(JobStatus status) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode statusNode = body.putObject("status");
        statusNode.put("phase", status.phase().label());
        statusNode.put("message", status.message());
        ObjectNode progress = statusNode.putObject("progress");
        progress.put(status.kind().totalField(), status.progress().total());
        progress.put(status.kind().processedField(), status.progress().processed());
        progress.put("percentage", status.progress().percentage());
        if (status.aliasSwapped() != null) {
            statusNode.put("aliasSwapped", status.aliasSwapped());
        }
        statusNode.put("lastUpdated", status.timestamp().toString());

        String url = apiServer + "/apis/" + API_GROUP + "/" + API_VERSION
                + "/namespaces/" + namespace + "/" + status.kind().plural() + "/" + status.name() + "/status";
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .patch(RequestBody.create(mapper.writeValueAsString(body), MERGE_PATCH))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Status patch returned HTTP " + response.code() + " for " + url);
            }
        }
    }

    private static OkHttpClient trustClusterCa(OkHttpClient httpClient, Path caFile) throws IOException, GeneralSecurityException {
        if (!Files.isReadable(caFile)) {
            return httpClient;
        }
        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        try (InputStream in = Files.newInputStream(caFile)) {
            int index = 0;
            for (Certificate certificate : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                keyStore.setCertificateEntry("cluster-ca-" + index++, certificate);
            }
        }
        TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(keyStore);
        TrustManager[] trustManagers = trustManagerFactory.getTrustManagers();
        if (trustManagers.length != 1 || !(trustManagers[0] instanceof X509TrustManager)) {
            throw new GeneralSecurityException("Unexpected trust managers: " + Arrays.toString(trustManagers));
        }
        X509TrustManager trustManager = (X509TrustManager) trustManagers[0];
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, new TrustManager[] { trustManager }, null);
        return httpClient.newBuilder()
                .sslSocketFactory(sslContext.getSocketFactory(), trustManager)
                .build();
    }
}
