package com.scholary.flow.assemblyai;

import java.nio.file.Path;

/**
 * Interface for the speech-to-text provider.
 *
 * <p>The three calls mirror the provider's workflow: upload the bytes once, create a job that
 * references the upload, then observe the job until it ends.
 */
public interface AssemblyAiService {

  /**
   * Upload a local audio file.
   *
   * @param audioFile the file to upload
   * @return the provider URL of the uploaded resource
   * @throws AssemblyAiException with kind UPLOAD_FAILED if the provider rejects the upload
   */
  String upload(Path audioFile);

  /**
   * Create a transcription job for an uploaded resource.
   *
   * @param uploadUrl the URL returned by {@link #upload}
   * @return the job id
   * @throws AssemblyAiException with kind SUBMIT_FAILED if the job cannot be created
   */
  String submit(String uploadUrl);

  /**
   * Poll a job until it completes, fails, or the attempt budget runs out.
   *
   * @param jobId the job id returned by {@link #submit}
   * @return the transcript text
   * @throws AssemblyAiException with kind TRANSCRIPTION_FAILED, TRANSCRIPTION_TIMEOUT, POLL_FAILED
   *     or INTERRUPTED
   */
  String pollUntilDone(String jobId);

  /** Submit a job and wait for its transcript. */
  default String transcribe(String uploadUrl) {
    return pollUntilDone(submit(uploadUrl));
  }
}
