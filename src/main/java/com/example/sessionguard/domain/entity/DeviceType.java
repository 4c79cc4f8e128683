package com.example.sessionguard.domain.entity;

/**
 * Coarse device class derived from the User-Agent header.
 */
public enum DeviceType {
  DESKTOP,
  MOBILE,
  TABLET
}
