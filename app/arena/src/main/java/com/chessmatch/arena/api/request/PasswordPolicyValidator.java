package com.chessmatch.arena.api.request;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class PasswordPolicyValidator implements ConstraintValidator<PasswordPolicy, String> {

  static final int MIN_LENGTH = 8;
  static final int MAX_LENGTH = 64;

  @Override
  public boolean isValid(String value, ConstraintValidatorContext context) {
    if (value == null || value.length() < MIN_LENGTH || value.length() > MAX_LENGTH) {
      return false;
    }
    boolean upper = false;
    boolean lower = false;
    boolean digit = false;
    boolean special = false;
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (Character.isUpperCase(c)) {
        upper = true;
      } else if (Character.isLowerCase(c)) {
        lower = true;
      } else if (Character.isDigit(c)) {
        digit = true;
      } else if (!Character.isWhitespace(c)) {
        special = true;
      }
    }
    return upper && lower && digit && special;
  }
}
