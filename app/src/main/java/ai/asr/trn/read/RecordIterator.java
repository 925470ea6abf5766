package ai.asr.trn.read;

import ai.asr.trn.transcript.UtteranceRecord;
import java.util.Iterator;

/**
 * Lazily produces records from a trn source and owns the resources needed to do so.
 */
interface RecordIterator extends Iterator<UtteranceRecord>, AutoCloseable {

    @Override
    void close();
}
