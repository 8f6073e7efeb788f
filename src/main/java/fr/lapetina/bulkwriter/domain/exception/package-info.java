/**
 * Errors delivered through write futures.
 *
 * <p>Every exception extends {@link fr.lapetina.bulkwriter.domain.exception.BulkWriterException}
 * and carries a {@link fr.lapetina.bulkwriter.domain.model.WriteErrorType}. None of them is
 * thrown across threads: the coordinator completes the affected futures exceptionally instead.
 */
package fr.lapetina.bulkwriter.domain.exception;
