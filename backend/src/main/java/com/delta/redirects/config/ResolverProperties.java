package com.delta.redirects.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resolver")
public class ResolverProperties {
    private static final String DEFAULT_USER_AGENT = "delta-redirect-resolver/0.1 (+contact)";

    private String userAgent;
    private String targetBaseUrl = "";
    private int activeRunMinutes = 60;
    private int staleRunMinutes = 120;
    private Probe probe = new Probe();
    private Pipeline pipeline = new Pipeline();
    private Data data = new Data();
    private Export export = new Export();
    private Delivery delivery = new Delivery();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getTargetBaseUrl() {
        return targetBaseUrl;
    }

    public void setTargetBaseUrl(String targetBaseUrl) {
        this.targetBaseUrl = targetBaseUrl;
    }

    public int getActiveRunMinutes() {
        return Math.max(1, activeRunMinutes);
    }

    public void setActiveRunMinutes(int activeRunMinutes) {
        this.activeRunMinutes = Math.max(1, activeRunMinutes);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Probe {
        private int requestTimeoutSeconds = 10;
        private int maxRedirects = 5;

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRedirects() {
            return Math.max(0, maxRedirects);
        }

        public void setMaxRedirects(int maxRedirects) {
            this.maxRedirects = Math.max(0, maxRedirects);
        }
    }

    public static class Pipeline {
        private int batchSize = 10;
        private int batchPauseMs = 100;
        private int progressLogEvery = 100;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getBatchPauseMs() {
            return Math.max(0, batchPauseMs);
        }

        public void setBatchPauseMs(int batchPauseMs) {
            this.batchPauseMs = Math.max(0, batchPauseMs);
        }

        public int getProgressLogEvery() {
            return Math.max(1, progressLogEvery);
        }

        public void setProgressLogEvery(int progressLogEvery) {
            this.progressLogEvery = Math.max(1, progressLogEvery);
        }
    }

    public static class Data {
        private String errorsFile = "../data/nest.pages_error.json";
        private String productsFile = "../data/nest.product1cs.json";
        private String catalogFile = "../data/nest.catalog1cs.json";

        public String getErrorsFile() {
            return errorsFile;
        }

        public void setErrorsFile(String errorsFile) {
            this.errorsFile = errorsFile;
        }

        public String getProductsFile() {
            return productsFile;
        }

        public void setProductsFile(String productsFile) {
            this.productsFile = productsFile;
        }

        public String getCatalogFile() {
            return catalogFile;
        }

        public void setCatalogFile(String catalogFile) {
            this.catalogFile = catalogFile;
        }
    }

    public static class Export {
        private String resultFile = "../result.json";
        private double defaultMinPercent = 0.0;

        public String getResultFile() {
            return resultFile;
        }

        public void setResultFile(String resultFile) {
            this.resultFile = resultFile;
        }

        public double getDefaultMinPercent() {
            return Math.max(0.0, Math.min(100.0, defaultMinPercent));
        }

        public void setDefaultMinPercent(double defaultMinPercent) {
            this.defaultMinPercent = defaultMinPercent;
        }
    }

    public static class Delivery {
        private String apiUrl;
        private String apiKey;
        private int requestTimeoutSeconds = 30;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean resetStore = true;
        private boolean skipStatusCheck;
        private boolean exportAfterRun;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isResetStore() {
            return resetStore;
        }

        public void setResetStore(boolean resetStore) {
            this.resetStore = resetStore;
        }

        public boolean isSkipStatusCheck() {
            return skipStatusCheck;
        }

        public void setSkipStatusCheck(boolean skipStatusCheck) {
            this.skipStatusCheck = skipStatusCheck;
        }

        public boolean isExportAfterRun() {
            return exportAfterRun;
        }

        public void setExportAfterRun(boolean exportAfterRun) {
            this.exportAfterRun = exportAfterRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
