package com.github.micycle1.torogrid.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.github.micycle1.torogrid.data.Quantity;

/**
 * Outcome of the accuracy self-check: how many nodes were compared per
 * quantity and every violation found. A report for a 3-D grid is
 * {@linkplain #isApplicable() not applicable} and holds nothing.
 */
public final class AccuracyReport {

	private final boolean applicable;
	private final double tolerance;
	private final Map<Quantity, Integer> checked;
	private final List<Violation> violations;

	private AccuracyReport(boolean applicable, double tolerance, Map<Quantity, Integer> checked, List<Violation> violations) {
		this.applicable = applicable;
		this.tolerance = tolerance;
		this.checked = checked;
		this.violations = violations;
	}

	public static AccuracyReport notApplicable(double tolerance) {
		return new AccuracyReport(false, tolerance, Collections.emptyMap(), Collections.emptyList());
	}

	public boolean isApplicable() {
		return applicable;
	}

	public double getTolerance() {
		return tolerance;
	}

	/** True when the check ran and found nothing. */
	public boolean passed() {
		return applicable && violations.isEmpty();
	}

	/** Node comparisons made for q, summed over cross-sections and timesteps. */
	public int getCheckedCount(Quantity q) {
		return checked.getOrDefault(q, 0);
	}

	public List<Violation> getViolations() {
		return violations;
	}

	public List<Violation> getViolations(Quantity q) {
		return violations.stream().filter(v -> v.getQuantity() == q).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		if (!applicable) {
			return "AccuracyReport[not applicable]";
		}
		return "AccuracyReport[tol=" + tolerance + ", checked=" + checked + ", violations=" + violations.size() + "]";
	}

	static final class Builder {

		private final double tolerance;
		private final Map<Quantity, Integer> checked = new EnumMap<>(Quantity.class);
		private final List<Violation> violations = new ArrayList<>();

		Builder(double tolerance) {
			this.tolerance = tolerance;
		}

		void addChecked(Quantity q, int count) {
			checked.merge(q, count, Integer::sum);
		}

		void add(Violation v) {
			violations.add(v);
		}

		AccuracyReport build() {
			return new AccuracyReport(true, tolerance, Collections.unmodifiableMap(new EnumMap<>(checked)),
					Collections.unmodifiableList(new ArrayList<>(violations)));
		}
	}
}
