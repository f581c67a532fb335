package com.example.notifier.sanitizer;

import java.util.regex.Pattern;

/** A named secret shape and the replacement that masks it. */
public record SecretPattern(String name, Pattern pattern, String replacement) {

  public static SecretPattern of(String name, String regex, String replacement) {
    return new SecretPattern(name, Pattern.compile(regex), replacement);
  }

  String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
