package com.flamingo.ai.mathgrader.service.equivalence;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SetListMatcherTest {

  private final SetListMatcher matcher = new SetListMatcher();

  @Test
  @DisplayName("sets match in any order")
  void setsIgnoreOrder() {
    EquivalenceVerdict verdict =
        matcher.match(List.of("A", "B"), List.of("B", "A"), AnswerKind.SET, Objects::equals);

    assertThat(verdict.equal()).isTrue();
  }

  @Test
  @DisplayName("a set member without a partner is reported")
  void setMissingMember() {
    EquivalenceVerdict verdict =
        matcher.match(List.of("A", "C"), List.of("B", "A"), AnswerKind.SET, Objects::equals);

    assertThat(verdict.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
    assertThat(verdict.diagnostic()).isEqualTo("No match for part 1");
  }

  @Test
  @DisplayName("lists compare by position")
  void listsRespectOrder() {
    EquivalenceVerdict verdict =
        matcher.match(List.of("A", "B"), List.of("B", "A"), AnswerKind.LIST, Objects::equals);

    assertThat(verdict.equal()).isFalse();
    assertThat(verdict.diagnostic()).isEqualTo("Part 0 differs");
  }

  @Test
  @DisplayName("different sizes never match")
  void sizeMismatch() {
    EquivalenceVerdict verdict =
        matcher.match(List.of("A"), List.of("A", "A"), AnswerKind.SET, Objects::equals);

    assertThat(verdict.diagnostic()).isEqualTo("Answer has 1 parts, expected 2");
  }

  @Test
  @DisplayName("each reference member is used at most once")
  void referenceMembersAreConsumed() {
    EquivalenceVerdict verdict =
        matcher.match(List.of("A", "A"), List.of("A", "B"), AnswerKind.SET, Objects::equals);

    assertThat(verdict.equal()).isFalse();
  }
}
