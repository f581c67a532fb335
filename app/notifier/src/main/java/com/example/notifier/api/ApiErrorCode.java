package com.example.notifier.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOTIFICATION_REQUEST_NOT_FOUND,
  INVALID_NOTIFICATION_REQUEST,
  INTERNAL_ERROR
}
