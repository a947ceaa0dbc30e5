package com.mk.fx.qa.vecro.service;

/**
 * Aggregated outcome of one workload request.
 *
 * @param success always {@code true} for a returned response; failures surface as exceptions
 * @param reads number of reads performed
 * @param writes number of writes performed
 * @param readBytes bytes returned by all reads
 * @param writeBytes bytes persisted by all writes
 * @param totalBytes {@code readBytes + writeBytes}
 */
public record WorkloadResponse(
    boolean success, int reads, int writes, long readBytes, long writeBytes, long totalBytes) {

  public static WorkloadResponse of(int reads, int writes, long readBytes, long writeBytes) {
    return new WorkloadResponse(true, reads, writes, readBytes, writeBytes, readBytes + writeBytes);
  }
}
