package com.gentoro.claimgraph;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.concurrent.MdcAwareExecutor;
import com.gentoro.claimgraph.derivative.DerivativeGenerator;
import com.gentoro.claimgraph.derivative.LlmDerivativeSource;
import com.gentoro.claimgraph.derivative.SelfConsistentDerivativeGenerator;
import com.gentoro.claimgraph.embedding.Embedder;
import com.gentoro.claimgraph.embedding.OpenAiEmbedder;
import com.gentoro.claimgraph.events.LoggingEventSink;
import com.gentoro.claimgraph.exception.ConfigException;
import com.gentoro.claimgraph.exception.StateException;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.graph.MarketGraphService;
import com.gentoro.claimgraph.http.OkHttpFactory;
import com.gentoro.claimgraph.llm.LlmClient;
import com.gentoro.claimgraph.llm.OpenAiLlmClient;
import com.gentoro.claimgraph.logging.LoggingService;
import com.gentoro.claimgraph.market.KalshiMarketSearch;
import com.gentoro.claimgraph.market.MarketSearch;
import com.gentoro.claimgraph.model.GraphRequest;
import com.gentoro.claimgraph.model.MarketGraphResponse;
import com.gentoro.claimgraph.pipeline.ClaimGraphBuilder;
import com.gentoro.claimgraph.pipeline.ClaimGraphStreamService;
import com.gentoro.claimgraph.pipeline.PipelineSettings;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import com.gentoro.claimgraph.suggest.LlmSuggestionClassifier;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.RetryPolicy;
import com.gentoro.claimgraph.verification.ExaEvidenceSearch;
import com.gentoro.claimgraph.verification.LlmVerificationAgent;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Wires the collaborators from configuration and runs one build in the requested mode. */
public class ClaimGraphRuntime implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ClaimGraphRuntime.class);

  private final StartupParameters startupParameters;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private ConfigurationProvider configurationProvider;
  private PipelineSettings settings;
  private MdcAwareExecutor executor;
  private ClaimGraphStreamService streamService;
  private MarketGraphService marketGraphService;

  public ClaimGraphRuntime(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    this.settings = PipelineSettings.from(configuration());
    if ("help".equals(startupParameters.mode())) {
      return;
    }

    this.executor = new MdcAwareExecutor(settings.executorThreads());
    BoundedFanOut fanOut = new BoundedFanOut(executor);
    RetryPolicy retryPolicy = RetryPolicy.standard();
    PromptRenderer prompts = new PromptRenderer();

    OpenAIClient openAi = OpenAIOkHttpClient.builder().apiKey(requireKey("llm.apiKey")).build();
    LlmClient llm =
        new OpenAiLlmClient(openAi, configuration().getString("llm.model", null), retryPolicy);
    LlmClient verificationLlm =
        new OpenAiLlmClient(
            openAi, configuration().getString("llm.verificationModel", "gpt-4o"), retryPolicy);

    OpenAIClient embeddingClient =
        OpenAIOkHttpClient.builder().apiKey(requireKey("embedding.apiKey")).build();
    Embedder embedder =
        new OpenAiEmbedder(
            embeddingClient, configuration().getString("embedding.model", null), retryPolicy);

    OkHttpClient http = OkHttpFactory.create(30);
    MarketSearch marketSearch =
        new KalshiMarketSearch(
            http,
            configuration().getString("kalshi.baseUrl", KalshiMarketSearch.DEFAULT_BASE_URL),
            retryPolicy);
    ExaEvidenceSearch evidenceSearch =
        new ExaEvidenceSearch(
            http,
            configuration().getString("exa.baseUrl", ExaEvidenceSearch.DEFAULT_BASE_URL),
            requireKey("exa.apiKey"),
            retryPolicy);

    DerivativeGenerator derivatives =
        new SelfConsistentDerivativeGenerator(new LlmDerivativeSource(llm, prompts), fanOut);

    LlmVerificationAgent verificationAgent =
        new LlmVerificationAgent(
            verificationLlm,
            evidenceSearch,
            prompts,
            configuration().getInt("exa.numResults", 5),
            new RetryPolicy(2, 500, 2000));

    ClaimGraphBuilder builder =
        new ClaimGraphBuilder(
            derivatives,
            embedder,
            verificationAgent,
            marketSearch,
            fanOut,
            settings);
    this.streamService = new ClaimGraphStreamService(builder, settings);
    this.marketGraphService =
        new MarketGraphService(
            derivatives,
            marketSearch,
            new LlmSuggestionClassifier(llm, prompts),
            embedder,
            fanOut,
            settings);
    log.info("Claim graph runtime initialized ({} worker threads)", settings.executorThreads());
  }

  public void run() {
    switch (startupParameters.mode()) {
      case "help" -> printUsage();
      case "stream" -> {
        if (streamService == null) {
          throw new StateException("Runtime not initialized. Call initialize() first.");
        }
        streamService.stream(request(), new LoggingEventSink(log));
      }
      case "graph" -> {
        if (marketGraphService == null) {
          throw new StateException("Runtime not initialized. Call initialize() first.");
        }
        MarketGraphResponse response = marketGraphService.build(request());
        log.info("[claimgraph.graph] {}", JacksonUtility.toJson(response));
      }
      default -> throw new ValidationException("Invalid mode: " + startupParameters.mode());
    }
  }

  GraphRequest request() {
    return new GraphRequest(
        startupParameters.worldview(),
        intParameter("k", GraphRequest.DEFAULT_K),
        intParameter("max-hops", GraphRequest.DEFAULT_MAX_HOPS),
        doubleParameter("threshold", GraphRequest.DEFAULT_THRESHOLD),
        intParameter("top-n", GraphRequest.DEFAULT_TOP_N));
  }

  private int intParameter(String name, int defaultValue) {
    String value = startupParameters.getOptionalParameter(name).orElse(null);
    if (value == null) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("--%s must be an integer: %s".formatted(name, value), e);
    }
  }

  private double doubleParameter(String name, double defaultValue) {
    String value = startupParameters.getOptionalParameter(name).orElse(null);
    if (value == null) return defaultValue;
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("--%s must be a number: %s".formatted(name, value), e);
    }
  }

  private String requireKey(String key) {
    String value = configuration().getString(key, null);
    // an unset ${env:...} reference is left verbatim by the interpolator
    if (value == null || value.isBlank() || value.startsWith("${")) {
      throw new ConfigException("Missing %s in configuration".formatted(key));
    }
    return value;
  }

  private void printUsage() {
    log.info(
        "Usage: --worldview \"<belief>\" [--mode stream|graph|help] [--config-file <location>]"
            + " [--k <1-1000>] [--max-hops <0-6>] [--threshold <0-1>] [--top-n <1-100>]");
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Runtime not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public PipelineSettings settings() {
    return settings;
  }

  /** Release the worker pool. Safe to call multiple times. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && executor != null) {
      executor.close();
    }
  }
}
