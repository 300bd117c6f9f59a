package com.flamingo.ai.factcheck.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EvidenceSet Tests")
class EvidenceSetTest {

  @Test
  @DisplayName("Should keep the first of duplicate origin/source pairs")
  void shouldDropDuplicates() {
    EvidenceItem first = item(EvidenceOrigin.LOCAL, "a.txt", "first");
    EvidenceItem duplicate = item(EvidenceOrigin.LOCAL, "a.txt", "second");
    EvidenceItem sameSourceOtherOrigin = item(EvidenceOrigin.WEB, "a.txt", "web");

    EvidenceSet set = EvidenceSet.ranked(List.of(first, duplicate, sameSourceOtherOrigin));

    assertThat(set.items()).extracting(EvidenceItem::getContent).containsExactly("first", "web");
    assertThat(set.items()).extracting(EvidenceItem::getRank).containsExactly(1, 2);
  }

  @Test
  @DisplayName("Should count and filter by origin")
  void shouldFilterByOrigin() {
    EvidenceSet set =
        EvidenceSet.ranked(
            List.of(
                item(EvidenceOrigin.LOCAL, "a.txt", "a"),
                item(EvidenceOrigin.WEB, "https://b", "b"),
                item(EvidenceOrigin.WEB, "https://c", "c")));

    assertThat(set.fromOrigin(EvidenceOrigin.WEB)).hasSize(2);
    assertThat(set.fromOrigin(EvidenceOrigin.LOCAL)).hasSize(1);
  }

  @Test
  @DisplayName("Should expose an unmodifiable item list")
  void shouldBeUnmodifiable() {
    EvidenceSet set = EvidenceSet.ranked(List.of(item(EvidenceOrigin.LOCAL, "a.txt", "a")));

    assertThatThrownBy(() -> set.items().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Should share the empty instance")
  void shouldShareEmptyInstance() {
    assertThat(EvidenceSet.ranked(List.of())).isSameAs(EvidenceSet.empty());
  }

  private static EvidenceItem item(EvidenceOrigin origin, String sourceId, String content) {
    return EvidenceItem.builder().origin(origin).sourceId(sourceId).content(content).build();
  }
}
