package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import com.flamingo.ai.deckplanner.service.template.model.TemplateGeometry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Process-wide cache of template analyses keyed by template identity.
 *
 * <p>The map only holds one future per template; reading and analysis run on the calling thread,
 * outside the map. At most one analysis per template runs at a time: concurrent callers for the
 * same template wait on the in-flight future and then read its result, while analyses of different
 * templates proceed independently. Cached analyses are immutable and safe to share. A failed
 * analysis is removed again, so the next caller retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateAnalysisCache {

  private final TemplateAnalyzer templateAnalyzer;
  private final MeterRegistry meterRegistry;

  private final Map<String, CompletableFuture<TemplateAnalysis>> analyses =
      new ConcurrentHashMap<>();

  public TemplateAnalysis getOrAnalyze(TemplateGeometry template) {
    return getOrAnalyze(template.templateId(), () -> template);
  }

  /** Reads the template through {@code reader} only when it has not been analyzed yet. */
  public TemplateAnalysis getOrAnalyze(String templateId, TemplateReader reader) {
    return getOrAnalyze(templateId, () -> reader.read(templateId));
  }

  public Optional<TemplateAnalysis> cached(String templateId) {
    CompletableFuture<TemplateAnalysis> future = analyses.get(templateId);
    if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
      return Optional.empty();
    }
    return Optional.of(future.join());
  }

  public void evict(String templateId) {
    if (analyses.remove(templateId) != null) {
      log.info("Evicted template analysis for '{}'", templateId);
    }
  }

  private TemplateAnalysis getOrAnalyze(String templateId, Supplier<TemplateGeometry> source) {
    CompletableFuture<TemplateAnalysis> created = new CompletableFuture<>();
    CompletableFuture<TemplateAnalysis> existing = analyses.putIfAbsent(templateId, created);
    if (existing != null) {
      meterRegistry.counter("template.analysis.cache.hit").increment();
      log.debug("Template analysis cache hit for '{}'", templateId);
      return await(existing);
    }

    meterRegistry.counter("template.analysis.cache.miss").increment();
    try {
      TemplateAnalysis analysis = templateAnalyzer.analyze(source.get());
      created.complete(analysis);
      return analysis;
    } catch (RuntimeException | Error e) {
      analyses.remove(templateId, created);
      created.completeExceptionally(e);
      throw e;
    }
  }

  private static TemplateAnalysis await(CompletableFuture<TemplateAnalysis> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
