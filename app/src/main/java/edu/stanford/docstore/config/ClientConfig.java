package edu.stanford.docstore.config;

import lombok.Data;

@Data
public final class ClientConfig {
  /** Project every key and RPC is scoped to */
  private String project;

  /** Namespace new keys default to; empty or absent for the default namespace */
  private String namespace;

  /** Host name or IP address of the docstore gRPC server, i.e. localhost, or 10.2.3.4 */
  private String host;

  /** Port where the docstore gRPC server is listening */
  private int port;

  /** Path to where metrics will be logged, relative to the config file. Optional. */
  private String metricsPath;

  public String getTarget() {
    return host + ":" + port;
  }
}
