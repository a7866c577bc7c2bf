package com.measure.compiler.generator;

import com.measure.compiler.model.TimingUnit;

import java.time.LocalDate;

/**
 * Warehouse-specific date arithmetic.
 */
public enum SqlDialect {
    SNOWFLAKE("snowflake") {
        @Override
        public String dateAdd(TimingUnit unit, int amount, String dateExpr) {
            return "dateadd(" + unit.label(1) + ", " + amount + ", " + dateExpr + ")";
        }

        @Override
        public String daysBetween(String start, String end) {
            return "datediff(day, " + start + ", " + end + ")";
        }

        @Override
        public String ageInYears(String birthDate, String asOf) {
            return "datediff(year, " + birthDate + ", " + asOf + ")\n"
                    + "      - case\n"
                    + "        when to_char(" + asOf + ", 'MMDD') < to_char(" + birthDate + ", 'MMDD') then 1\n"
                    + "        else 0\n"
                    + "      end";
        }

        @Override
        public String dateLiteral(LocalDate date) {
            return "to_date('" + date + "')";
        }
    },

    POSTGRES("postgres") {
        @Override
        public String dateAdd(TimingUnit unit, int amount, String dateExpr) {
            String sign = amount < 0 ? " - " : " + ";
            int magnitude = Math.abs(amount);
            return "(" + dateExpr + sign + "interval '" + magnitude + " " + unit.label(magnitude) + "')";
        }

        @Override
        public String daysBetween(String start, String end) {
            return "(" + end + "::date - " + start + "::date)";
        }

        @Override
        public String ageInYears(String birthDate, String asOf) {
            return "date_part('year', age(" + asOf + ", " + birthDate + "))";
        }

        @Override
        public String dateLiteral(LocalDate date) {
            return "date '" + date + "'";
        }
    };

    private final String value;

    SqlDialect(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Shift a date expression; negative amounts go back in time.
     */
    public abstract String dateAdd(TimingUnit unit, int amount, String dateExpr);

    public abstract String daysBetween(String start, String end);

    /**
     * Whole years between a birth date and a reference date.
     */
    public abstract String ageInYears(String birthDate, String asOf);

    public abstract String dateLiteral(LocalDate date);
}
