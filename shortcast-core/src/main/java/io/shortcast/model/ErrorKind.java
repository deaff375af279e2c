package io.shortcast.model;

/**
 * Classification of a failed or skipped channel attempt.
 */
public enum ErrorKind {
  /** Credentials missing, expired or rejected by the platform. */
  CREDENTIAL,
  /** Transport-level failure talking to the platform. */
  NETWORK,
  /** The platform or upload library rejected the upload. */
  UPLOAD,
  /** The channel's video variant could not be generated. */
  GENERATION,
  /** A secondary channel had no primary video to re-publish. */
  NO_SOURCE_VIDEO,
  UNKNOWN
}
