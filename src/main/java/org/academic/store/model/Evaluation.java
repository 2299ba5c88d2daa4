package org.academic.store.model;

import java.util.Objects;

/**
 * A dated, commented score. The date (DD/MM/YYYY) is used to address it for updates.
 */
public class Evaluation {
    public float score;
    public String comment;
    public String date;

    public Evaluation() {
    }

    public Evaluation(float score, String comment, String date) {
        this.score = score;
        this.comment = comment;
        this.date = date;
    }

    public Evaluation copy() {
        return new Evaluation(score, comment, date);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Evaluation)) return false;
        Evaluation other = (Evaluation) o;
        return Float.compare(score, other.score) == 0 &&
               Objects.equals(comment, other.comment) &&
               Objects.equals(date, other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, comment, date);
    }

    @Override
    public String toString() {
        return String.format("Evaluation{date=%s, score=%.1f, comment='%s'}", date, score, comment);
    }
}
