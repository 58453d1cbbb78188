package com.delta.acquisition.config;

import com.delta.acquisition.acquire.model.CostTier;
import com.delta.acquisition.acquire.model.ResourceKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "acquisition")
public class AcquisitionProperties {
    private static final String DEFAULT_USER_AGENT = "delta-acquisition-engine/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Timeouts timeouts = new Timeouts();
    private Retry retry = new Retry();
    private Pools pools = new Pools();
    private Strategy strategy = new Strategy();
    private Map<String, Site> sites = new LinkedHashMap<>();
    private Direct direct = new Direct();
    private Vision vision = new Vision();
    private Scraper scraper = new Scraper();
    private Cost cost = new Cost();
    private Events events = new Events();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Pools getPools() {
        return pools;
    }

    public void setPools(Pools pools) {
        this.pools = pools;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public Map<String, Site> getSites() {
        return sites;
    }

    public void setSites(Map<String, Site> sites) {
        this.sites = sites == null ? new LinkedHashMap<>() : sites;
    }

    public Direct getDirect() {
        return direct;
    }

    public void setDirect(Direct direct) {
        this.direct = direct;
    }

    public Vision getVision() {
        return vision;
    }

    public void setVision(Vision vision) {
        this.vision = vision;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Cost getCost() {
        return cost;
    }

    public void setCost(Cost cost) {
        this.cost = cost;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Timeouts {
        private int requestSeconds = 90;
        private int navigationSeconds = 30;
        private int analysisSeconds = 45;
        private int cleanupGraceMs = 5000;

        public int getRequestSeconds() {
            return Math.max(1, requestSeconds);
        }

        public void setRequestSeconds(int requestSeconds) {
            this.requestSeconds = Math.max(1, requestSeconds);
        }

        public int getNavigationSeconds() {
            return Math.max(1, navigationSeconds);
        }

        public void setNavigationSeconds(int navigationSeconds) {
            this.navigationSeconds = Math.max(1, navigationSeconds);
        }

        public int getAnalysisSeconds() {
            return Math.max(1, analysisSeconds);
        }

        public void setAnalysisSeconds(int analysisSeconds) {
            this.analysisSeconds = Math.max(1, analysisSeconds);
        }

        public int getCleanupGraceMs() {
            return Math.max(0, cleanupGraceMs);
        }

        public void setCleanupGraceMs(int cleanupGraceMs) {
            this.cleanupGraceMs = Math.max(0, cleanupGraceMs);
        }
    }

    public static class Retry {
        private int maxAttempts = 2;
        private int backoffMs = 1000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBackoffMs() {
            return Math.max(0, backoffMs);
        }

        public void setBackoffMs(int backoffMs) {
            this.backoffMs = Math.max(0, backoffMs);
        }
    }

    public static class Pools {
        private int leaseWaitMs = 2000;
        private int leaseBackoffMs = 100;
        private double decayFactor = 0.5;
        private double healthFloor = 0.2;
        private double recoveryStep = 0.1;
        private double restoreHealth = 0.5;
        private int maxProbeFailures = 3;
        private boolean reconcileEnabled = true;
        private int reconcileIntervalSeconds = 60;
        private int probeTimeoutMs = 3000;
        private Pool identity = new Pool(8);
        private Pool proxy = new Pool(0);
        private Pool token = new Pool(0);
        private Pool session = new Pool(4);
        private Pool worker = new Pool(4);
        private Pool parser = new Pool(2);

        public int getLeaseWaitMs() {
            return Math.max(0, leaseWaitMs);
        }

        public void setLeaseWaitMs(int leaseWaitMs) {
            this.leaseWaitMs = Math.max(0, leaseWaitMs);
        }

        public int getLeaseBackoffMs() {
            return Math.max(1, leaseBackoffMs);
        }

        public void setLeaseBackoffMs(int leaseBackoffMs) {
            this.leaseBackoffMs = Math.max(1, leaseBackoffMs);
        }

        public double getDecayFactor() {
            return clamp(decayFactor, 0.0, 1.0);
        }

        public void setDecayFactor(double decayFactor) {
            this.decayFactor = clamp(decayFactor, 0.0, 1.0);
        }

        public double getHealthFloor() {
            return clamp(healthFloor, 0.0, 1.0);
        }

        public void setHealthFloor(double healthFloor) {
            this.healthFloor = clamp(healthFloor, 0.0, 1.0);
        }

        public double getRecoveryStep() {
            return clamp(recoveryStep, 0.0, 1.0);
        }

        public void setRecoveryStep(double recoveryStep) {
            this.recoveryStep = clamp(recoveryStep, 0.0, 1.0);
        }

        public double getRestoreHealth() {
            return clamp(restoreHealth, 0.0, 1.0);
        }

        public void setRestoreHealth(double restoreHealth) {
            this.restoreHealth = clamp(restoreHealth, 0.0, 1.0);
        }

        public int getMaxProbeFailures() {
            return Math.max(1, maxProbeFailures);
        }

        public void setMaxProbeFailures(int maxProbeFailures) {
            this.maxProbeFailures = Math.max(1, maxProbeFailures);
        }

        public boolean isReconcileEnabled() {
            return reconcileEnabled;
        }

        public void setReconcileEnabled(boolean reconcileEnabled) {
            this.reconcileEnabled = reconcileEnabled;
        }

        public int getReconcileIntervalSeconds() {
            return Math.max(1, reconcileIntervalSeconds);
        }

        public void setReconcileIntervalSeconds(int reconcileIntervalSeconds) {
            this.reconcileIntervalSeconds = Math.max(1, reconcileIntervalSeconds);
        }

        public int getProbeTimeoutMs() {
            return Math.max(1, probeTimeoutMs);
        }

        public void setProbeTimeoutMs(int probeTimeoutMs) {
            this.probeTimeoutMs = Math.max(1, probeTimeoutMs);
        }

        public Pool getIdentity() {
            return identity;
        }

        public void setIdentity(Pool identity) {
            this.identity = identity;
        }

        public Pool getProxy() {
            return proxy;
        }

        public void setProxy(Pool proxy) {
            this.proxy = proxy;
        }

        public Pool getToken() {
            return token;
        }

        public void setToken(Pool token) {
            this.token = token;
        }

        public Pool getSession() {
            return session;
        }

        public void setSession(Pool session) {
            this.session = session;
        }

        public Pool getWorker() {
            return worker;
        }

        public void setWorker(Pool worker) {
            this.worker = worker;
        }

        public Pool getParser() {
            return parser;
        }

        public void setParser(Pool parser) {
            this.parser = parser;
        }

        public Pool forKind(ResourceKind kind) {
            return switch (kind) {
                case IDENTITY -> identity;
                case PROXY -> proxy;
                case TOKEN -> token;
                case SESSION -> session;
                case WORKER -> worker;
                case PARSER -> parser;
            };
        }
    }

    public static class Pool {
        private int capacity;
        private List<String> items = new ArrayList<>();
        private List<String> reserve = new ArrayList<>();
        private int ttlMinutes = 60;

        public Pool() {
        }

        public Pool(int capacity) {
            this.capacity = capacity;
        }

        public int getCapacity() {
            return Math.max(0, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(0, capacity);
        }

        public List<String> getItems() {
            return items;
        }

        public void setItems(List<String> items) {
            this.items = items == null ? new ArrayList<>() : items;
        }

        public List<String> getReserve() {
            return reserve;
        }

        public void setReserve(List<String> reserve) {
            this.reserve = reserve == null ? new ArrayList<>() : reserve;
        }

        public int getTtlMinutes() {
            return Math.max(1, ttlMinutes);
        }

        public void setTtlMinutes(int ttlMinutes) {
            this.ttlMinutes = Math.max(1, ttlMinutes);
        }
    }

    public static class Strategy {
        private double defaultDifficulty = 0.3;
        private double cloudThreshold = 0.8;
        private double hybridThreshold = 0.5;
        private double learningRate = 0.2;
        private String difficultyTable = "classpath:site_difficulty.csv";

        public double getDefaultDifficulty() {
            return clamp(defaultDifficulty, 0.0, 1.0);
        }

        public void setDefaultDifficulty(double defaultDifficulty) {
            this.defaultDifficulty = clamp(defaultDifficulty, 0.0, 1.0);
        }

        public double getCloudThreshold() {
            return cloudThreshold;
        }

        public void setCloudThreshold(double cloudThreshold) {
            this.cloudThreshold = cloudThreshold;
        }

        public double getHybridThreshold() {
            return hybridThreshold;
        }

        public void setHybridThreshold(double hybridThreshold) {
            this.hybridThreshold = hybridThreshold;
        }

        public double getLearningRate() {
            return clamp(learningRate, 0.0, 1.0);
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = clamp(learningRate, 0.0, 1.0);
        }

        public String getDifficultyTable() {
            return difficultyTable;
        }

        public void setDifficultyTable(String difficultyTable) {
            this.difficultyTable = difficultyTable;
        }
    }

    public static class Site {
        private String url;
        private String searchUrlTemplate;
        private Double difficulty;
        private String directType;
        private String directBoard;
        private String feedUrl;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getSearchUrlTemplate() {
            return searchUrlTemplate;
        }

        public void setSearchUrlTemplate(String searchUrlTemplate) {
            this.searchUrlTemplate = searchUrlTemplate;
        }

        public Double getDifficulty() {
            return difficulty;
        }

        public void setDifficulty(Double difficulty) {
            this.difficulty = difficulty == null ? null : clamp(difficulty, 0.0, 1.0);
        }

        public String getDirectType() {
            return directType;
        }

        public void setDirectType(String directType) {
            this.directType = directType;
        }

        public String getDirectBoard() {
            return directBoard;
        }

        public void setDirectBoard(String directBoard) {
            this.directBoard = directBoard;
        }

        public String getFeedUrl() {
            return feedUrl;
        }

        public void setFeedUrl(String feedUrl) {
            this.feedUrl = feedUrl;
        }
    }

    public static class Direct {
        private String greenhouseApiBase = "https://boards-api.greenhouse.io";
        private String leverApiBase = "https://api.lever.co";

        public String getGreenhouseApiBase() {
            return stripTrailingSlash(greenhouseApiBase);
        }

        public void setGreenhouseApiBase(String greenhouseApiBase) {
            this.greenhouseApiBase = greenhouseApiBase;
        }

        public String getLeverApiBase() {
            return stripTrailingSlash(leverApiBase);
        }

        public void setLeverApiBase(String leverApiBase) {
            this.leverApiBase = leverApiBase;
        }
    }

    public static class Vision {
        private double matchThreshold = 0.8;
        private double actionThreshold = 0.75;
        private int maxDomChars = 20000;
        private Local local = new Local();
        private Remote remote = new Remote();

        public double getMatchThreshold() {
            return clamp(matchThreshold, 0.0, 1.0);
        }

        public void setMatchThreshold(double matchThreshold) {
            this.matchThreshold = clamp(matchThreshold, 0.0, 1.0);
        }

        public double getActionThreshold() {
            return clamp(actionThreshold, 0.0, 1.0);
        }

        public void setActionThreshold(double actionThreshold) {
            this.actionThreshold = clamp(actionThreshold, 0.0, 1.0);
        }

        public int getMaxDomChars() {
            return Math.max(1000, maxDomChars);
        }

        public void setMaxDomChars(int maxDomChars) {
            this.maxDomChars = Math.max(1000, maxDomChars);
        }

        public Local getLocal() {
            return local;
        }

        public void setLocal(Local local) {
            this.local = local;
        }

        public Remote getRemote() {
            return remote;
        }

        public void setRemote(Remote remote) {
            this.remote = remote;
        }
    }

    public static class Local {
        private String providerId = "local-vision";
        private String baseUrl = "http://localhost:11434";
        private String model = "llava";
        private double defaultConfidence = 0.7;

        public String getProviderId() {
            return providerId;
        }

        public void setProviderId(String providerId) {
            this.providerId = providerId;
        }

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getDefaultConfidence() {
            return clamp(defaultConfidence, 0.0, 1.0);
        }

        public void setDefaultConfidence(double defaultConfidence) {
            this.defaultConfidence = clamp(defaultConfidence, 0.0, 1.0);
        }
    }

    public static class Remote {
        private String providerId = "remote-vision";
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o";
        private String apiKey;
        private double defaultConfidence = 0.9;
        private double inputCostPer1k = 0.01;
        private double outputCostPer1k = 0.03;
        private double estimatedCallCost = 0.04;
        private int maxTokens = 1500;

        public String getProviderId() {
            return providerId;
        }

        public void setProviderId(String providerId) {
            this.providerId = providerId;
        }

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public double getDefaultConfidence() {
            return clamp(defaultConfidence, 0.0, 1.0);
        }

        public void setDefaultConfidence(double defaultConfidence) {
            this.defaultConfidence = clamp(defaultConfidence, 0.0, 1.0);
        }

        public double getInputCostPer1k() {
            return Math.max(0.0, inputCostPer1k);
        }

        public void setInputCostPer1k(double inputCostPer1k) {
            this.inputCostPer1k = Math.max(0.0, inputCostPer1k);
        }

        public double getOutputCostPer1k() {
            return Math.max(0.0, outputCostPer1k);
        }

        public void setOutputCostPer1k(double outputCostPer1k) {
            this.outputCostPer1k = Math.max(0.0, outputCostPer1k);
        }

        public double getEstimatedCallCost() {
            return Math.max(0.0, estimatedCallCost);
        }

        public void setEstimatedCallCost(double estimatedCallCost) {
            this.estimatedCallCost = Math.max(0.0, estimatedCallCost);
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }
    }

    public static class Scraper {
        private int stabilizeMinMs = 1000;
        private int stabilizeMaxMs = 3000;
        private int pointerStepsMin = 8;
        private int pointerStepsMax = 20;
        private int pointerStepDelayMs = 15;
        private boolean headless = true;
        private int viewportWidth = 1366;
        private int viewportHeight = 768;

        public int getStabilizeMinMs() {
            return Math.max(0, stabilizeMinMs);
        }

        public void setStabilizeMinMs(int stabilizeMinMs) {
            this.stabilizeMinMs = Math.max(0, stabilizeMinMs);
        }

        public int getStabilizeMaxMs() {
            return Math.max(getStabilizeMinMs(), stabilizeMaxMs);
        }

        public void setStabilizeMaxMs(int stabilizeMaxMs) {
            this.stabilizeMaxMs = Math.max(0, stabilizeMaxMs);
        }

        public int getPointerStepsMin() {
            return Math.max(2, pointerStepsMin);
        }

        public void setPointerStepsMin(int pointerStepsMin) {
            this.pointerStepsMin = Math.max(2, pointerStepsMin);
        }

        public int getPointerStepsMax() {
            return Math.max(getPointerStepsMin(), pointerStepsMax);
        }

        public void setPointerStepsMax(int pointerStepsMax) {
            this.pointerStepsMax = Math.max(2, pointerStepsMax);
        }

        public int getPointerStepDelayMs() {
            return Math.max(0, pointerStepDelayMs);
        }

        public void setPointerStepDelayMs(int pointerStepDelayMs) {
            this.pointerStepDelayMs = Math.max(0, pointerStepDelayMs);
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getViewportWidth() {
            return Math.max(320, viewportWidth);
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = Math.max(320, viewportWidth);
        }

        public int getViewportHeight() {
            return Math.max(240, viewportHeight);
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = Math.max(240, viewportHeight);
        }
    }

    public static class Cost {
        private String zone = "UTC";
        private Map<String, Double> dailyCaps = new LinkedHashMap<>();
        private List<TimeOfDayRule> timeOfDay = new ArrayList<>();

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public Map<String, Double> getDailyCaps() {
            return dailyCaps;
        }

        public void setDailyCaps(Map<String, Double> dailyCaps) {
            this.dailyCaps = dailyCaps == null ? new LinkedHashMap<>() : dailyCaps;
        }

        public List<TimeOfDayRule> getTimeOfDay() {
            return timeOfDay;
        }

        public void setTimeOfDay(List<TimeOfDayRule> timeOfDay) {
            this.timeOfDay = timeOfDay == null ? new ArrayList<>() : timeOfDay;
        }
    }

    public static class TimeOfDayRule {
        private int fromHour;
        private int toHour = 24;
        private CostTier maxTier = CostTier.REMOTE_VISION;

        public TimeOfDayRule() {
        }

        public TimeOfDayRule(int fromHour, int toHour, CostTier maxTier) {
            setFromHour(fromHour);
            setToHour(toHour);
            this.maxTier = maxTier;
        }

        public int getFromHour() {
            return fromHour;
        }

        public void setFromHour(int fromHour) {
            this.fromHour = Math.max(0, Math.min(23, fromHour));
        }

        public int getToHour() {
            return toHour;
        }

        public void setToHour(int toHour) {
            this.toHour = Math.max(0, Math.min(24, toHour));
        }

        public CostTier getMaxTier() {
            return maxTier;
        }

        public void setMaxTier(CostTier maxTier) {
            this.maxTier = maxTier;
        }

        /**
         * Half-open range {@code [fromHour, toHour)}; a range with {@code fromHour > toHour} wraps midnight.
         */
        public boolean covers(int hour) {
            if (fromHour == toHour) {
                return false;
            }
            if (fromHour < toHour) {
                return hour >= fromHour && hour < toHour;
            }
            return hour >= fromHour || hour < toHour;
        }
    }

    public static class Events {
        private boolean enabled = true;
        private int defaultListLimit = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = Math.max(1, defaultListLimit);
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
