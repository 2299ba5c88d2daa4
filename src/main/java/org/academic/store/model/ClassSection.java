package org.academic.store.model;

import java.util.Objects;

/**
 * A course section (turma). Keyed by {@code id}, unique across the class table.
 */
public class ClassSection {
    public int id;
    public String disciplineName;
    public String professorName;

    public ClassSection() {
    }

    public ClassSection(int id, String disciplineName, String professorName) {
        this.id = id;
        this.disciplineName = disciplineName;
        this.professorName = professorName;
    }

    public ClassSection copy() {
        return new ClassSection(id, disciplineName, professorName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassSection)) return false;
        ClassSection other = (ClassSection) o;
        return id == other.id &&
               Objects.equals(disciplineName, other.disciplineName) &&
               Objects.equals(professorName, other.professorName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, disciplineName, professorName);
    }

    @Override
    public String toString() {
        return "ClassSection{id=" + id + ", discipline=" + disciplineName + ", professor=" + professorName + "}";
    }
}
