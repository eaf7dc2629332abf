package com.flamingo.ai.deckplanner.service.selection;

import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable selection history of one deck generation run.
 *
 * <p>Owned by a single caller for the duration of the run and discarded afterwards. Instances are
 * not thread-safe and must not be shared between runs; slides are selected one after another in
 * deck order.
 */
public class SequenceState {

  private final int totalSlides;
  private final int historyLimit;
  private final List<Integer> usedLayoutHistory = new ArrayList<>();
  private final List<StoryType> usedStoryTypeHistory = new ArrayList<>();
  private List<StoryType> plannedStoryArc;

  public SequenceState(int totalSlides, int historyLimit) {
    if (totalSlides < 1) {
      throw new IllegalArgumentException("A deck needs at least one slide, got " + totalSlides);
    }
    if (historyLimit < 2) {
      throw new IllegalArgumentException("History limit must be at least 2, got " + historyLimit);
    }
    this.totalSlides = totalSlides;
    this.historyLimit = historyLimit;
  }

  public int getTotalSlides() {
    return totalSlides;
  }

  public boolean isPlanned() {
    return plannedStoryArc != null;
  }

  public List<StoryType> getPlannedStoryArc() {
    return plannedStoryArc == null ? List.of() : plannedStoryArc;
  }

  void plan(List<StoryType> arc) {
    if (plannedStoryArc != null) {
      throw new IllegalStateException("Story arc is already planned");
    }
    plannedStoryArc = List.copyOf(arc);
  }

  /** Planned story type for a slide; indexes past the end reuse the last entry. */
  public StoryType plannedStoryType(int slideIndex) {
    List<StoryType> arc = getPlannedStoryArc();
    if (arc.isEmpty()) {
      throw new IllegalStateException("Story arc has not been planned yet");
    }
    return arc.get(Math.min(slideIndex, arc.size() - 1));
  }

  public List<Integer> getUsedLayoutHistory() {
    return Collections.unmodifiableList(usedLayoutHistory);
  }

  public List<StoryType> getUsedStoryTypeHistory() {
    return Collections.unmodifiableList(usedStoryTypeHistory);
  }

  public int size() {
    return usedLayoutHistory.size();
  }

  /** The {@code n}-th most recent layout, 1 being the last one. */
  int recentLayout(int n) {
    return usedLayoutHistory.get(usedLayoutHistory.size() - n);
  }

  StoryType recentStoryType(int n) {
    return usedStoryTypeHistory.get(usedStoryTypeHistory.size() - n);
  }

  List<Integer> lastLayouts(int window) {
    return usedLayoutHistory.subList(
        Math.max(0, usedLayoutHistory.size() - window), usedLayoutHistory.size());
  }

  List<StoryType> lastStoryTypes(int window) {
    return usedStoryTypeHistory.subList(
        Math.max(0, usedStoryTypeHistory.size() - window), usedStoryTypeHistory.size());
  }

  void record(int layoutIndex, StoryType storyType) {
    usedLayoutHistory.add(layoutIndex);
    usedStoryTypeHistory.add(storyType);
    while (usedLayoutHistory.size() > historyLimit) {
      usedLayoutHistory.remove(0);
      usedStoryTypeHistory.remove(0);
    }
  }
}
