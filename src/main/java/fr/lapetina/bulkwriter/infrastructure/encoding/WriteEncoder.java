package fr.lapetina.bulkwriter.infrastructure.encoding;

import fr.lapetina.bulkwriter.domain.exception.WriteEncodingException;
import fr.lapetina.bulkwriter.domain.model.DocumentRef;
import fr.lapetina.bulkwriter.domain.model.WriteOperation;
import fr.lapetina.bulkwriter.domain.model.WritePayload;

/**
 * Turns a caller's mutation intent into an encoded write.
 */
@FunctionalInterface
public interface WriteEncoder {

    /**
     * @param operation kind of write
     * @param document  target document
     * @param data      document data; must be null for deletes
     * @throws WriteEncodingException if no payload can be built
     */
    WritePayload encode(WriteOperation operation, DocumentRef document, Object data);
}
