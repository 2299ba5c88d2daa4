package org.academic.store.persistence;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Fixed-size binary layout of one record type.
 * Every record written takes exactly {@link #recordSize()} bytes.
 */
public interface RecordLayout<T> {

    int recordSize();

    void write(DataOutput out, T record) throws IOException;

    T read(DataInput in) throws IOException;
}
