package com.jobscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private List<String> keywords = new ArrayList<>();
    private int pagesPerKeyword = 5;
    private int workerCount = 2;
    private int cutoffDays = 14;
    private int maxRetries = 2;
    private int zeroAdmittedPageThreshold = 2;
    private int maxJobsPerPage = 25;
    private int staleRunMinutes = 60;
    private Site site = new Site();
    private Pacing pacing = new Pacing();
    private Resolver resolver = new Resolver();
    private Filter filter = new Filter();
    private AntiBot antiBot = new AntiBot();
    private Browser browser = new Browser();
    private Store store = new Store();
    private Session session = new Session();
    private Cli cli = new Cli();

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords == null ? new ArrayList<>() : keywords;
    }

    public int getPagesPerKeyword() {
        return Math.max(1, pagesPerKeyword);
    }

    public void setPagesPerKeyword(int pagesPerKeyword) {
        this.pagesPerKeyword = Math.max(1, pagesPerKeyword);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getCutoffDays() {
        return Math.max(0, cutoffDays);
    }

    public void setCutoffDays(int cutoffDays) {
        this.cutoffDays = Math.max(0, cutoffDays);
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getZeroAdmittedPageThreshold() {
        return Math.max(1, zeroAdmittedPageThreshold);
    }

    public void setZeroAdmittedPageThreshold(int zeroAdmittedPageThreshold) {
        this.zeroAdmittedPageThreshold = Math.max(1, zeroAdmittedPageThreshold);
    }

    public int getMaxJobsPerPage() {
        return Math.max(1, maxJobsPerPage);
    }

    public void setMaxJobsPerPage(int maxJobsPerPage) {
        this.maxJobsPerPage = Math.max(1, maxJobsPerPage);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Site getSite() {
        return site;
    }

    public void setSite(Site site) {
        this.site = site;
    }

    public Pacing getPacing() {
        return pacing;
    }

    public void setPacing(Pacing pacing) {
        this.pacing = pacing;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public AntiBot getAntiBot() {
        return antiBot;
    }

    public void setAntiBot(AntiBot antiBot) {
        this.antiBot = antiBot;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Site {
        private String name = "eluta";
        private String baseUrl = "https://www.eluta.ca";
        private String listingDomain = "eluta.ca";
        private String containerSelector = "div";
        private String jobDetailPathMarker = "/job/";
        private List<String> excludedLinkPatterns = new ArrayList<>(List.of(
            "canadastop100.com",
            "reviews.",
            "top-employer",
            "employer-review",
            "company-profile",
            "employer-profile",
            "about-employer",
            "top100"
        ));
        private String featuredEmployerBadge = "TOP EMPLOYER";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getListingDomain() {
            return listingDomain;
        }

        public void setListingDomain(String listingDomain) {
            this.listingDomain = listingDomain;
        }

        public String getContainerSelector() {
            return containerSelector;
        }

        public void setContainerSelector(String containerSelector) {
            this.containerSelector = containerSelector;
        }

        public String getJobDetailPathMarker() {
            return jobDetailPathMarker;
        }

        public void setJobDetailPathMarker(String jobDetailPathMarker) {
            this.jobDetailPathMarker = jobDetailPathMarker;
        }

        public List<String> getExcludedLinkPatterns() {
            return excludedLinkPatterns;
        }

        public void setExcludedLinkPatterns(List<String> excludedLinkPatterns) {
            this.excludedLinkPatterns = excludedLinkPatterns == null ? new ArrayList<>() : excludedLinkPatterns;
        }

        public String getFeaturedEmployerBadge() {
            return featuredEmployerBadge;
        }

        public void setFeaturedEmployerBadge(String featuredEmployerBadge) {
            this.featuredEmployerBadge = featuredEmployerBadge;
        }
    }

    public static class Pacing {
        private int pageDelayMinMs = 2000;
        private int pageDelayMaxMs = 4000;
        private int keywordDelayMinMs = 3000;
        private int keywordDelayMaxMs = 6000;

        public int getPageDelayMinMs() {
            return Math.max(0, pageDelayMinMs);
        }

        public void setPageDelayMinMs(int pageDelayMinMs) {
            this.pageDelayMinMs = Math.max(0, pageDelayMinMs);
        }

        public int getPageDelayMaxMs() {
            return Math.max(getPageDelayMinMs(), pageDelayMaxMs);
        }

        public void setPageDelayMaxMs(int pageDelayMaxMs) {
            this.pageDelayMaxMs = Math.max(0, pageDelayMaxMs);
        }

        public int getKeywordDelayMinMs() {
            return Math.max(0, keywordDelayMinMs);
        }

        public void setKeywordDelayMinMs(int keywordDelayMinMs) {
            this.keywordDelayMinMs = Math.max(0, keywordDelayMinMs);
        }

        public int getKeywordDelayMaxMs() {
            return Math.max(getKeywordDelayMinMs(), keywordDelayMaxMs);
        }

        public void setKeywordDelayMaxMs(int keywordDelayMaxMs) {
            this.keywordDelayMaxMs = Math.max(0, keywordDelayMaxMs);
        }
    }

    public static class Resolver {
        private int clickTimeoutMs = 8000;
        private int settleMs = 3000;
        private int preClickMinMs = 100;
        private int preClickMaxMs = 500;
        private int minAnchorTextLength = 10;
        private List<String> roleKeywords = new ArrayList<>(List.of(
            "analyst",
            "developer",
            "engineer",
            "manager",
            "specialist",
            "coordinator",
            "associate",
            "consultant",
            "advisor",
            "officer",
            "representative",
            "technician",
            "scientist",
            "administrator"
        ));
        private List<String> navigationKeywords = new ArrayList<>(List.of(
            "next",
            "more",
            "previous",
            "prev",
            "page",
            "show all"
        ));

        public int getClickTimeoutMs() {
            return Math.max(100, clickTimeoutMs);
        }

        public void setClickTimeoutMs(int clickTimeoutMs) {
            this.clickTimeoutMs = Math.max(100, clickTimeoutMs);
        }

        public int getSettleMs() {
            return Math.max(0, settleMs);
        }

        public void setSettleMs(int settleMs) {
            this.settleMs = Math.max(0, settleMs);
        }

        public int getPreClickMinMs() {
            return Math.max(0, preClickMinMs);
        }

        public void setPreClickMinMs(int preClickMinMs) {
            this.preClickMinMs = Math.max(0, preClickMinMs);
        }

        public int getPreClickMaxMs() {
            return Math.max(getPreClickMinMs(), preClickMaxMs);
        }

        public void setPreClickMaxMs(int preClickMaxMs) {
            this.preClickMaxMs = Math.max(0, preClickMaxMs);
        }

        public int getMinAnchorTextLength() {
            return Math.max(1, minAnchorTextLength);
        }

        public void setMinAnchorTextLength(int minAnchorTextLength) {
            this.minAnchorTextLength = Math.max(1, minAnchorTextLength);
        }

        public List<String> getRoleKeywords() {
            return roleKeywords;
        }

        public void setRoleKeywords(List<String> roleKeywords) {
            this.roleKeywords = roleKeywords == null ? new ArrayList<>() : roleKeywords;
        }

        public List<String> getNavigationKeywords() {
            return navigationKeywords;
        }

        public void setNavigationKeywords(List<String> navigationKeywords) {
            this.navigationKeywords = navigationKeywords == null ? new ArrayList<>() : navigationKeywords;
        }
    }

    public static class Filter {
        private List<String> entryLevelKeywords = new ArrayList<>(List.of(
            "entry level",
            "entry-level",
            "junior",
            "jr.",
            "associate",
            "graduate",
            "new grad",
            "recent graduate",
            "trainee",
            "intern",
            "internship",
            "co-op",
            "coop",
            "student",
            "level i",
            "level 1",
            "0-1 years",
            "0-2 years",
            "1-2 years",
            "no experience required",
            "no experience necessary"
        ));
        private List<String> seniorKeywords = new ArrayList<>(List.of(
            "senior",
            "sr.",
            "lead",
            "principal",
            "manager",
            "director",
            "supervisor",
            "head of",
            "chief",
            "vp",
            "vice president",
            "architect",
            "staff engineer",
            "3+ years",
            "4+ years",
            "5+ years",
            "6+ years",
            "7+ years",
            "8+ years",
            "10+ years",
            "minimum 3 years",
            "minimum 5 years",
            "at least 3 years",
            "at least 5 years"
        ));

        public List<String> getEntryLevelKeywords() {
            return entryLevelKeywords;
        }

        public void setEntryLevelKeywords(List<String> entryLevelKeywords) {
            this.entryLevelKeywords = entryLevelKeywords == null ? new ArrayList<>() : entryLevelKeywords;
        }

        public List<String> getSeniorKeywords() {
            return seniorKeywords;
        }

        public void setSeniorKeywords(List<String> seniorKeywords) {
            this.seniorKeywords = seniorKeywords == null ? new ArrayList<>() : seniorKeywords;
        }
    }

    public static class AntiBot {
        private int maxRecoveryAttempts = 3;
        private String recoveryMode = "visible-browser";
        private int verificationTimeoutSeconds = 180;
        private int verificationPollMs = 2000;
        private List<Integer> cooldownStepsSeconds = new ArrayList<>(List.of(30, 120, 300));

        public int getMaxRecoveryAttempts() {
            return Math.max(1, maxRecoveryAttempts);
        }

        public void setMaxRecoveryAttempts(int maxRecoveryAttempts) {
            this.maxRecoveryAttempts = Math.max(1, maxRecoveryAttempts);
        }

        public String getRecoveryMode() {
            return recoveryMode;
        }

        public void setRecoveryMode(String recoveryMode) {
            this.recoveryMode = recoveryMode;
        }

        public int getVerificationTimeoutSeconds() {
            return Math.max(1, verificationTimeoutSeconds);
        }

        public void setVerificationTimeoutSeconds(int verificationTimeoutSeconds) {
            this.verificationTimeoutSeconds = Math.max(1, verificationTimeoutSeconds);
        }

        public int getVerificationPollMs() {
            return Math.max(100, verificationPollMs);
        }

        public void setVerificationPollMs(int verificationPollMs) {
            this.verificationPollMs = Math.max(100, verificationPollMs);
        }

        public List<Integer> getCooldownStepsSeconds() {
            return cooldownStepsSeconds;
        }

        public void setCooldownStepsSeconds(List<Integer> cooldownStepsSeconds) {
            this.cooldownStepsSeconds = cooldownStepsSeconds == null ? new ArrayList<>() : cooldownStepsSeconds;
        }
    }

    public static class Browser {
        private boolean headless = true;
        private int navigationTimeoutMs = 30000;
        private int viewportWidth = 1366;
        private int viewportHeight = 768;
        private String userAgent =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/121.0.0.0 Safari/537.36";
        private String locale = "en-CA";

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = Math.max(1000, navigationTimeoutMs);
        }

        public int getViewportWidth() {
            return viewportWidth;
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return viewportHeight;
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }
    }

    public static class Store {
        private int retentionDays = 14;
        private boolean cleanupOnStartup = true;
        private int statsCompanyLimit = 20;

        public int getRetentionDays() {
            return Math.max(1, retentionDays);
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(1, retentionDays);
        }

        public boolean isCleanupOnStartup() {
            return cleanupOnStartup;
        }

        public void setCleanupOnStartup(boolean cleanupOnStartup) {
            this.cleanupOnStartup = cleanupOnStartup;
        }

        public int getStatsCompanyLimit() {
            return Math.max(1, statsCompanyLimit);
        }

        public void setStatsCompanyLimit(int statsCompanyLimit) {
            this.statsCompanyLimit = Math.max(1, statsCompanyLimit);
        }
    }

    public static class Session {
        private String stateFile = "data/session-state.json";
        private int maxAgeHours = 24;

        public String getStateFile() {
            return stateFile;
        }

        public void setStateFile(String stateFile) {
            this.stateFile = stateFile;
        }

        public int getMaxAgeHours() {
            return Math.max(1, maxAgeHours);
        }

        public void setMaxAgeHours(int maxAgeHours) {
            this.maxAgeHours = Math.max(1, maxAgeHours);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;
        private String exportPath;
        private String exportFormat = "csv";

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getExportPath() {
            return exportPath;
        }

        public void setExportPath(String exportPath) {
            this.exportPath = exportPath;
        }

        public String getExportFormat() {
            return exportFormat;
        }

        public void setExportFormat(String exportFormat) {
            this.exportFormat = exportFormat;
        }
    }
}
