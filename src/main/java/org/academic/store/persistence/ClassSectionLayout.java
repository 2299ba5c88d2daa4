package org.academic.store.persistence;

import org.academic.store.model.ClassSection;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * id (int) | discipline name (100) | professor name (100)
 */
public class ClassSectionLayout implements RecordLayout<ClassSection> {

    @Override
    public int recordSize() {
        return Integer.BYTES + 2 * FixedText.NAME_SLOT;
    }

    @Override
    public void write(DataOutput out, ClassSection record) throws IOException {
        out.writeInt(record.id);
        FixedText.write(out, record.disciplineName, FixedText.NAME_SLOT);
        FixedText.write(out, record.professorName, FixedText.NAME_SLOT);
    }

    @Override
    public ClassSection read(DataInput in) throws IOException {
        ClassSection section = new ClassSection();
        section.id = in.readInt();
        section.disciplineName = FixedText.read(in, FixedText.NAME_SLOT);
        section.professorName = FixedText.read(in, FixedText.NAME_SLOT);
        return section;
    }
}
