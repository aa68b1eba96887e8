package com.venuelink.adapter.core;

public enum RequestClass {
  PUBLIC,
  PRIVATE
}
