package com.acme.relay.queue;

public enum PayloadKind {
  TEXT,
  MEDIA
}
