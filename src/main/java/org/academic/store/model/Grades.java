package org.academic.store.model;

import java.util.Objects;

/**
 * Grade sheet embedded in a student. Always replaced as a whole.
 */
public class Grades {
    public float np1;
    public float np2;
    public float pimProject;
    public float average;

    public Grades() {
    }

    public Grades(float np1, float np2, float pimProject, float average) {
        this.np1 = np1;
        this.np2 = np2;
        this.pimProject = pimProject;
        this.average = average;
    }

    /**
     * Builds a grade sheet whose average is the arithmetic mean of the three scores.
     */
    public static Grades withAverage(float np1, float np2, float pimProject) {
        return new Grades(np1, np2, pimProject, (np1 + np2 + pimProject) / 3f);
    }

    public Grades copy() {
        return new Grades(np1, np2, pimProject, average);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grades)) return false;
        Grades other = (Grades) o;
        return Float.compare(np1, other.np1) == 0 &&
               Float.compare(np2, other.np2) == 0 &&
               Float.compare(pimProject, other.pimProject) == 0 &&
               Float.compare(average, other.average) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(np1, np2, pimProject, average);
    }

    @Override
    public String toString() {
        return String.format("Grades{np1=%.1f, np2=%.1f, pim=%.1f, average=%.2f}", np1, np2, pimProject, average);
    }
}
