package com.scholary.dubbing.api;

/**
 * Result of a finished dubbing job.
 *
 * @param outputFile local path of the dubbed file
 * @param metadataFile local path of the utterance metadata, null if it is gone
 * @param utterances number of dubbed utterances
 * @param cleanupFailures working-directory entries that could not be removed
 * @param outputUrl presigned URL of the published file, null unless published
 * @param metadataUrl presigned URL of the published metadata, null unless published
 */
public record DubbingResponse(
    String outputFile,
    String metadataFile,
    int utterances,
    int cleanupFailures,
    String outputUrl,
    String metadataUrl) {}
