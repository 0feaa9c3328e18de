package com.chessmatch.arena.api.request;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** 8〜64 文字で、大文字/小文字/数字/記号をそれぞれ 1 文字以上含むこと. */
@Documented
@Constraint(validatedBy = PasswordPolicyValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface PasswordPolicy {

  String message() default
      "password must be 8-64 characters and contain an uppercase letter, a lowercase letter,"
          + " a digit and a special character";

  Class<?>[] groups() default {};

  Class<? extends Payload>[] payload() default {};
}
