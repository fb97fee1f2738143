/**
 * Resume state of the ingestion phases: checkpoints and completion markers kept as small text
 * files.
 */
package io.github.yok.crmexport.checkpoint;
