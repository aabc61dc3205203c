package com.polyhunter.bounty.exception;

import java.util.Locale;

/**
 * Thrown when accepting a submission would push a request past its budget
 */
public class BudgetExceededException extends BountyException {

    private final long wouldSpendCents;
    private final long budgetTotalCents;

    public BudgetExceededException(long wouldSpendCents, long budgetTotalCents) {
        super(String.format(Locale.ROOT, "Accepting would exceed budget ($%.2f > $%.2f)",
                wouldSpendCents / 100.0, budgetTotalCents / 100.0));
        this.wouldSpendCents = wouldSpendCents;
        this.budgetTotalCents = budgetTotalCents;
    }

    public long getWouldSpendCents() {
        return wouldSpendCents;
    }

    public long getBudgetTotalCents() {
        return budgetTotalCents;
    }
}
