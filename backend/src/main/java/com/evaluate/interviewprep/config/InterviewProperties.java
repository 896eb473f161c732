package com.evaluate.interviewprep.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable heuristics for the interview engine, bound from {@code interview.*}.
 *
 * <p>Every threshold, keyword list and weight used by evaluation, behavior classification,
 * question selection and scoring lives here so it can be adjusted without code changes.
 */
@Data
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {

    private Evaluation evaluation = new Evaluation();
    private Behavior behavior = new Behavior();
    private Questions questions = new Questions();
    private Scoring scoring = new Scoring();
    private Session session = new Session();

    @Data
    public static class Evaluation {
        /** Scores under this count as low quality. */
        private double lowQualityThreshold = 5.0;
        private int minPlausibleWords = 5;
        private int shortAnswerWords = 10;
        /** Word count at which the length part of depth stops growing. */
        private int depthSaturationWords = 80;
        private int runOnSentenceWords = 45;

        private List<String> reasoningMarkers = new ArrayList<>(List.of(
                "because", "therefore", "so that", "which means", "as a result", "leads to",
                "in order to", "this allows", "the reason", "consequently", "due to", "trade-off"));

        private List<String> techniqueKeywords = new ArrayList<>(List.of(
                "algorithm", "complexity", "performance", "optimization", "architecture",
                "design", "pattern", "implementation", "database", "api", "framework",
                "testing", "deployment", "scalability", "security", "authentication",
                "authorization", "cache", "queue", "microservice", "container", "cloud",
                "distributed", "concurrent", "asynchronous", "synchronous", "protocol",
                "interface", "abstraction", "inheritance", "polymorphism", "encapsulation"));

        private List<String> connectors = new ArrayList<>(List.of(
                "first", "second", "third", "finally", "then", "next", "after",
                "because", "therefore", "however", "additionally", "furthermore",
                "for example", "such as", "specifically", "in particular"));

        private List<String> exampleMarkers = new ArrayList<>(List.of(
                "for example", "for instance", "such as", "in my last", "at my previous",
                "we built", "i built", "i implemented", "we implemented", "in production"));

        private Map<String, List<String>> categoryKeywords = defaultCategoryKeywords();
    }

    @Data
    public static class Behavior {
        private int chattyWordThreshold = 150;
        private int efficientWordMax = 30;
        private double efficientDensityMin = 0.15;
        private int tangentMin = 2;
        /** Consecutive edge-case inputs tolerated before the redirect suggests ending early. */
        private int edgeCaseTolerance = 2;
        /** Skip and refusal phrases only count in answers up to this length. */
        private int commandMaxWords = 12;
        /** Share of 3+ letter words below which input is treated as gibberish. */
        private double gibberishWordShare = 0.3;
        private int minMeaningfulLength = 5;
        /** Answers longer than this are checked for drifting away from the question. */
        private int offTopicMinWords = 100;
        /** Minimum share of question keywords an answer must echo to count as on topic. */
        private double offTopicOverlapMin = 0.3;
        /** Words shorter than this are ignored when comparing answer and question keywords. */
        private int keywordMinLength = 4;

        private List<String> stopWords = new ArrayList<>(List.of(
                "the", "and", "but", "for", "with", "from", "was", "are", "were", "been", "being",
                "have", "has", "had", "does", "did", "will", "would", "should", "could", "may",
                "might", "can", "this", "that", "these", "those", "they", "your", "you", "what",
                "when", "where", "which", "about", "into", "then", "than", "them", "there"));

        /** Requests to skip, cheat or stop answering; matched as whole phrases so ordinary answers pass. */
        private List<String> skipPhrases = new ArrayList<>(List.of(
                "skip question", "skip this", "skip the question", "skip that", "skip it", "skip all",
                "can i skip", "can we skip", "let me skip", "pass on this", "next question",
                "give me the answer", "get the answer", "just pass me", "just cheat", "help me cheat",
                "can i cheat", "let me cheat", "hack the interview", "bypass the question", "i refuse",
                "won't answer", "not answering", "don't want to answer", "let's move on",
                "can we move on", "just move on"));

        private List<String> singleWordCommands = new ArrayList<>(List.of(
                "skip", "pass", "next", "whatever", "nothing", "exit", "quit"));

        private List<String> confusionMarkers = new ArrayList<>(List.of(
                "don't understand", "do not understand", "confused", "can you help", "help me",
                "not sure what you mean", "what do you mean", "can you explain the question",
                "unclear", "i don't know", "unsure", "could you rephrase"));

        private List<String> questionReferenceTerms = new ArrayList<>(List.of(
                "question", "mean", "asking", "clarify", "rephrase"));

        private List<String> tangentMarkers = new ArrayList<>(List.of(
                "by the way", "funny story", "off topic", "reminds me", "anyway", "my weekend",
                "my family", "my dog", "my cat", "vacation", "long story", "side note", "unrelated"));

        private List<String> technicalTerms = new ArrayList<>(List.of(
                "react", "angular", "vue", "node", "express", "django", "flask", "spring",
                "kubernetes", "docker", "aws", "azure", "gcp", "postgresql", "mongodb", "redis",
                "elasticsearch", "kafka", "graphql", "rest", "grpc", "microservices", "serverless",
                "terraform", "ansible", "jenkins", "python", "java", "javascript", "typescript",
                "rust", "tensorflow", "pytorch", "pandas", "numpy", "spark", "sql", "nosql", "api",
                "oauth", "jwt", "websocket", "http", "tcp", "udp", "cache", "index", "queue",
                "hash", "algorithm", "database", "thread", "mutex", "lock", "latency", "throughput",
                "sharding", "replication", "stack", "heap", "tree", "graph", "lifo", "fifo"));
    }

    @Data
    public static class Questions {
        private int minQuestions = 5;
        private int maxQuestions = 10;
        private double minTechnicalRatio = 0.4;
        private double maxTechnicalRatio = 0.7;
        private double ratioJitter = 0.05;
        private int followUpCap = 2;
        private int maxResumeTechnicalQuestions = 2;
        private int maxDrillSuggestions = 3;
        private String bankLocation = "data/question-bank.json";
    }

    @Data
    public static class Scoring {
        private double communicationWeight = 0.5;
        private double technicalWeight = 0.5;
        /** When no technical question was answered, score on communication alone instead of weighting in a zero. */
        private boolean communicationOnlyWithoutTechnical = true;
        private double gradeA = 90;
        private double gradeB = 80;
        private double gradeC = 70;
        private double gradeD = 60;
        /** Average at or above which a category or dimension is a strength. */
        private double strengthThreshold = 7.0;
        /** Share of turns a chatty or confused style must hold to affect scoring. */
        private double persistentBehaviorShare = 0.5;
        private double behaviorPenalty = 2.0;

        private List<String> fillerWords = new ArrayList<>(List.of(
                "um", "uh", "like", "you know", "basically", "actually"));
        private List<String> casualPhrases = new ArrayList<>(List.of(
                "gonna", "wanna", "kinda", "sorta", "yeah", "nope"));
        private List<String> actionVerbs = new ArrayList<>(List.of(
                "implement", "design", "optimize", "analyze", "evaluate", "develop"));
    }

    @Data
    public static class Session {
        private Duration averageQuestionTime = Duration.ofMinutes(3);
    }

    private static Map<String, List<String>> defaultCategoryKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("data structures", List.of("array", "list", "tree", "graph", "hash", "stack", "queue", "heap", "linked list"));
        keywords.put("algorithms", List.of("sort", "search", "traverse", "recursive", "iterative", "complexity", "big o", "time", "space"));
        keywords.put("system design", List.of("scalability", "availability", "consistency", "partition", "load balancer", "cache", "database", "microservice"));
        keywords.put("database", List.of("sql", "query", "index", "transaction", "normalization", "join", "schema", "optimization"));
        keywords.put("api development", List.of("rest", "endpoint", "http", "request", "response", "authentication", "authorization", "versioning"));
        keywords.put("javascript", List.of("closure", "promise", "async", "callback", "prototype", "event", "dom", "react", "node"));
        keywords.put("machine learning", List.of("model", "training", "feature", "prediction", "classification", "regression", "neural", "accuracy"));
        keywords.put("statistics", List.of("mean", "median", "variance", "distribution", "hypothesis", "correlation", "regression", "sample"));
        keywords.put("infrastructure", List.of("server", "deployment", "container", "kubernetes", "docker", "cloud", "terraform", "automation"));
        keywords.put("ui development", List.of("component", "responsive", "css", "layout", "accessibility", "performance", "render", "state"));
        keywords.put("coding", List.of("thread", "lock", "synchronization", "function", "class", "recursion", "complexity", "test"));
        keywords.put("automation", List.of("pipeline", "ci/cd", "script", "build", "deploy", "rollback", "test", "jenkins"));
        keywords.put("troubleshooting", List.of("logs", "metrics", "alert", "monitoring", "root cause", "dashboard", "trace", "incident"));
        keywords.put("analytics", List.of("metric", "kpi", "baseline", "experiment", "cohort", "funnel", "conversion", "a/b"));
        keywords.put("product strategy", List.of("user", "market", "roadmap", "prioritize", "value", "impact", "research", "customer"));
        keywords.put("problem solving", List.of("reproduce", "hypothesis", "isolate", "root cause", "logging", "monitoring", "fix", "verify"));
        return keywords;
    }
}
