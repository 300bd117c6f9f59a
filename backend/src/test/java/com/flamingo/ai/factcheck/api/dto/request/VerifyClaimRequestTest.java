package com.flamingo.ai.factcheck.api.dto.request;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VerifyClaimRequest Validation Tests")
class VerifyClaimRequestTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  @Test
  @DisplayName("Should reject a missing claim")
  void shouldRejectNullClaim() {
    Set<ConstraintViolation<VerifyClaimRequest>> violations =
        validator.validate(new VerifyClaimRequest(null));

    assertThat(violations).extracting(ConstraintViolation::getMessage)
        .containsExactly("Claim is required");
  }

  @Test
  @DisplayName("Should leave the length limit to the configurable pipeline check")
  void shouldNotLimitClaimLength() {
    assertThat(validator.validate(new VerifyClaimRequest("x".repeat(5000)))).isEmpty();
  }
}
