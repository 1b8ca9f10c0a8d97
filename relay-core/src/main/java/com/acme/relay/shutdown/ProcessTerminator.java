package com.acme.relay.shutdown;

/** Ends the process. Hosts decide how; tests record the exit code. */
@FunctionalInterface
public interface ProcessTerminator {
  void terminate(int exitCode);
}
