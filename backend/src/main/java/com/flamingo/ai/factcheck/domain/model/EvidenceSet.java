package com.flamingo.ai.factcheck.domain.model;

import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered evidence for one verification request.
 *
 * <p>Items are unique by origin and source id, and their ranks always run 1..n in list order.
 * Instances are only created through {@link #ranked(List)}, which enforces both.
 */
public final class EvidenceSet implements Iterable<EvidenceItem> {

  private static final EvidenceSet EMPTY = new EvidenceSet(List.of());

  private final List<EvidenceItem> items;

  private EvidenceSet(List<EvidenceItem> items) {
    this.items = Collections.unmodifiableList(items);
  }

  public static EvidenceSet empty() {
    return EMPTY;
  }

  /**
   * Builds a set from items already in their final order. Later duplicates of an origin/source
   * pair are dropped and ranks are rewritten as 1..n.
   *
   * @param ordered items in the desired order
   * @return the ranked evidence set
   */
  public static EvidenceSet ranked(List<EvidenceItem> ordered) {
    Map<String, EvidenceItem> unique = new LinkedHashMap<>();
    for (EvidenceItem item : ordered) {
      unique.putIfAbsent(item.identity(), item);
    }
    List<EvidenceItem> result = new ArrayList<>(unique.values());
    for (int i = 0; i < result.size(); i++) {
      result.get(i).setRank(i + 1);
    }
    return result.isEmpty() ? EMPTY : new EvidenceSet(result);
  }

  public List<EvidenceItem> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public List<EvidenceItem> fromOrigin(EvidenceOrigin origin) {
    return items.stream().filter(item -> item.getOrigin() == origin).toList();
  }

  @Override
  public Iterator<EvidenceItem> iterator() {
    return items.iterator();
  }

  @Override
  public String toString() {
    return "EvidenceSet{size=" + items.size() + "}";
  }
}
