package org.academic.store.table;

import org.academic.store.OperationResult;
import org.academic.store.model.ClassSection;
import org.academic.store.persistence.FixedText;

import java.util.List;

/**
 * Class sections keyed by id.
 */
public class ClassTable extends KeyedTable<ClassSection> {

    public ClassTable(int capacity) {
        super(capacity, section -> section.id);
    }

    /**
     * Appends a copy of {@code section}. Capacity is checked before uniqueness.
     */
    public OperationResult insert(ClassSection section) {
        if (isFull()) {
            return OperationResult.CAPACITY_EXCEEDED;
        }
        if (contains(section.id)) {
            return OperationResult.DUPLICATE;
        }
        records.put(section.id, normalize(section));
        return OperationResult.OK;
    }

    public List<ClassSection> list(int limit) {
        return copies(records.values(), limit);
    }

    public boolean updateFields(int id, String disciplineName, String professorName) {
        ClassSection section = records.get(id);
        if (section == null) {
            return false;
        }
        section.disciplineName = FixedText.fit(disciplineName, FixedText.NAME_SLOT);
        section.professorName = FixedText.fit(professorName, FixedText.NAME_SLOT);
        return true;
    }

    /**
     * Changes the id of a single class. Dependent students are not touched here.
     */
    public OperationResult rekey(int oldId, int newId) {
        if (oldId == newId) {
            return OperationResult.OK;
        }
        if (contains(newId)) {
            return OperationResult.CONFLICT;
        }
        ClassSection section = records.get(oldId);
        if (section == null) {
            return OperationResult.NOT_FOUND;
        }
        section.id = newId;
        moveKey(oldId, newId);
        return OperationResult.OK;
    }

    @Override
    protected ClassSection normalize(ClassSection section) {
        return new ClassSection(section.id,
            FixedText.fit(section.disciplineName, FixedText.NAME_SLOT),
            FixedText.fit(section.professorName, FixedText.NAME_SLOT));
    }

    @Override
    protected ClassSection copyOf(ClassSection section) {
        return section.copy();
    }
}
