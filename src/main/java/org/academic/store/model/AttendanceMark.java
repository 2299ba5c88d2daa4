package org.academic.store.model;

import java.util.Objects;

public class AttendanceMark {
    public String date;  // DD/MM/YYYY
    public boolean present;

    public AttendanceMark() {
    }

    public AttendanceMark(String date, boolean present) {
        this.date = date;
        this.present = present;
    }

    public AttendanceMark copy() {
        return new AttendanceMark(date, present);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttendanceMark)) return false;
        AttendanceMark other = (AttendanceMark) o;
        return present == other.present && Objects.equals(date, other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, present);
    }

    @Override
    public String toString() {
        return "AttendanceMark{date=" + date + ", present=" + present + "}";
    }
}
