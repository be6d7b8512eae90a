package com.zzf.workspace.core.workspace;

import lombok.Value;

/**
 * On-disk fingerprint taken at read time.
 */
@Value
public class ReadVersion {
    long modifiedAtNanos;
    long sizeBytes;
}
