package com.sqlstage.sqlstage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized staging and bootstrap configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "sqlstage")
public class SqlStageProperties {

    private final Cache cache = new Cache();
    private final Transfer transfer = new Transfer();
    private final Bootstrap bootstrap = new Bootstrap();
    private Map<String, Engine> engines = new LinkedHashMap<>();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Map<String, Bundle> bundles = new LinkedHashMap<>();

    public Cache getCache() {
        return cache;
    }

    public Transfer getTransfer() {
        return transfer;
    }

    public Bootstrap getBootstrap() {
        return bootstrap;
    }

    public Map<String, Engine> getEngines() {
        return engines;
    }

    public void setEngines(Map<String, Engine> engines) {
        this.engines = engines;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources;
    }

    public Map<String, Bundle> getBundles() {
        return bundles;
    }

    public void setBundles(Map<String, Bundle> bundles) {
        this.bundles = bundles;
    }

    public static class Cache {

        private String root = SqlStageConstants.DEFAULT_CACHE_ROOT;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }
    }

    public static class Transfer {

        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private String interactiveEndpoint = SqlStageConstants.DEFAULT_INTERACTIVE_ENDPOINT;
        private List<String> interactiveHosts = new ArrayList<>(SqlStageConstants.DEFAULT_INTERACTIVE_HOSTS);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getInteractiveEndpoint() {
            return interactiveEndpoint;
        }

        public void setInteractiveEndpoint(String interactiveEndpoint) {
            this.interactiveEndpoint = interactiveEndpoint;
        }

        public List<String> getInteractiveHosts() {
            return interactiveHosts;
        }

        public void setInteractiveHosts(List<String> interactiveHosts) {
            this.interactiveHosts = interactiveHosts;
        }
    }

    /**
     * Defaults for a bootstrap run when the caller leaves a value unset.
     */
    public static class Bootstrap {

        private List<String> datasets = new ArrayList<>(SqlStageConstants.DEFAULT_DATASETS);
        private List<String> engines = new ArrayList<>();
        private boolean reset;
        private boolean forceDownload;
        private boolean skipSchemaDump;
        private boolean runOnStartup;

        public List<String> getDatasets() {
            return datasets;
        }

        public void setDatasets(List<String> datasets) {
            this.datasets = datasets;
        }

        public List<String> getEngines() {
            return engines;
        }

        public void setEngines(List<String> engines) {
            this.engines = engines;
        }

        public boolean isReset() {
            return reset;
        }

        public void setReset(boolean reset) {
            this.reset = reset;
        }

        public boolean isForceDownload() {
            return forceDownload;
        }

        public void setForceDownload(boolean forceDownload) {
            this.forceDownload = forceDownload;
        }

        public boolean isSkipSchemaDump() {
            return skipSchemaDump;
        }

        public void setSkipSchemaDump(boolean skipSchemaDump) {
            this.skipSchemaDump = skipSchemaDump;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }
    }

    /**
     * One running database engine reachable through a command prefix (for example {@code docker exec -i <container>}).
     */
    public static class Engine {

        private List<String> commandPrefix = new ArrayList<>();
        private String client;
        private String dumpClient;
        private String user = SqlStageConstants.DEFAULT_DB_USER;
        private String rootPassword;

        public List<String> getCommandPrefix() {
            return commandPrefix;
        }

        public void setCommandPrefix(List<String> commandPrefix) {
            this.commandPrefix = commandPrefix;
        }

        public String getClient() {
            return client;
        }

        public void setClient(String client) {
            this.client = client;
        }

        public String getDumpClient() {
            return dumpClient;
        }

        public void setDumpClient(String dumpClient) {
            this.dumpClient = dumpClient;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getRootPassword() {
            return rootPassword;
        }

        public void setRootPassword(String rootPassword) {
            this.rootPassword = rootPassword;
        }
    }

    /**
     * Raw per-dataset source entry; converted into a typed descriptor when the catalog is built.
     */
    public static class Source {

        private String type;
        private String url;
        private String stagedName;
        private String archiveName;
        private String member;
        private String bundle;
        private String key;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getStagedName() {
            return stagedName;
        }

        public void setStagedName(String stagedName) {
            this.stagedName = stagedName;
        }

        public String getArchiveName() {
            return archiveName;
        }

        public void setArchiveName(String archiveName) {
            this.archiveName = archiveName;
        }

        public String getMember() {
            return member;
        }

        public void setMember(String member) {
            this.member = member;
        }

        public String getBundle() {
            return bundle;
        }

        public void setBundle(String bundle) {
            this.bundle = bundle;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    public static class Bundle {

        private String type;
        private String url;
        private String archiveName;
        private String extractDir;
        private Map<String, String> sqlMembers = new LinkedHashMap<>();
        private Map<String, String> questionsMembers = new LinkedHashMap<>();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getArchiveName() {
            return archiveName;
        }

        public void setArchiveName(String archiveName) {
            this.archiveName = archiveName;
        }

        public String getExtractDir() {
            return extractDir;
        }

        public void setExtractDir(String extractDir) {
            this.extractDir = extractDir;
        }

        public Map<String, String> getSqlMembers() {
            return sqlMembers;
        }

        public void setSqlMembers(Map<String, String> sqlMembers) {
            this.sqlMembers = sqlMembers;
        }

        public Map<String, String> getQuestionsMembers() {
            return questionsMembers;
        }

        public void setQuestionsMembers(Map<String, String> questionsMembers) {
            this.questionsMembers = questionsMembers;
        }
    }
}
