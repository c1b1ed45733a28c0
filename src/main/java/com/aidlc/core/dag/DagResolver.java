package com.aidlc.core.dag;

import com.aidlc.core.model.BlockedUnit;
import com.aidlc.core.model.DagClassification;
import com.aidlc.core.model.DagSummary;
import com.aidlc.core.model.DagValidationError;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies the units of one intent by scheduling state and checks the graph's structure.
 * <p>
 * Every operation is a pure function of the unit snapshot it is given. Results are never
 * cached because unit records may change between calls, including from other processes.
 */
@Service
public class DagResolver {

    private static final Logger log = LoggerFactory.getLogger(DagResolver.class);

    /**
     * Groups units into ready, blocked, in-progress and completed.
     * <p>
     * A PENDING unit is ready iff every dependency resolves to a COMPLETED unit. Otherwise it is
     * blocked by exactly the dependencies that are not completed; an id that resolves to no unit
     * counts as not completed. Units whose own status is BLOCKED are listed as blocked with
     * their outstanding dependencies (possibly none).
     */
    public DagClassification classify(List<Unit> units) {
        Map<String, UnitStatus> statusById = statusIndex(units);

        var ready = new ArrayList<String>();
        var blocked = new ArrayList<BlockedUnit>();
        var inProgress = new ArrayList<String>();
        var completed = new ArrayList<String>();

        for (Unit unit : units) {
            switch (unit.status()) {
                case PENDING -> {
                    List<String> waitingOn = incompleteDependencies(unit, statusById);
                    if (waitingOn.isEmpty()) {
                        log.debug("  {} - ready (deps: {})", unit.id(), unit.dependsOn());
                        ready.add(unit.id());
                    } else {
                        log.debug("  {} - blocked by {}", unit.id(), waitingOn);
                        blocked.add(new BlockedUnit(unit.id(), waitingOn));
                    }
                }
                case BLOCKED -> blocked.add(new BlockedUnit(unit.id(), incompleteDependencies(unit, statusById)));
                case IN_PROGRESS -> inProgress.add(unit.id());
                case COMPLETED -> completed.add(unit.id());
            }
        }
        return new DagClassification(ready, blocked, inProgress, completed);
    }

    public DagSummary summary(List<Unit> units) {
        Map<String, UnitStatus> statusById = statusIndex(units);
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int blocked = 0;
        int ready = 0;

        for (Unit unit : units) {
            switch (unit.status()) {
                case PENDING -> {
                    pending++;
                    if (incompleteDependencies(unit, statusById).isEmpty()) {
                        ready++;
                    } else {
                        blocked++;
                    }
                }
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case BLOCKED -> blocked++;
            }
        }
        return new DagSummary(pending, inProgress, completed, blocked, ready);
    }

    /**
     * True iff every unit is COMPLETED. Vacuously true for no units; an intent without units
     * is still not eligible for integration, which the integrator checks separately.
     */
    public boolean isComplete(List<Unit> units) {
        return units.stream().allMatch(u -> u.status() == UnitStatus.COMPLETED);
    }

    /**
     * Reports dependencies on unknown units and self-dependencies.
     * <p>
     * Longer cycles (A depends on B depends on A) are not detected. Such units all show up as
     * blocked in {@link #summary} with zero ready, which is how callers notice the deadlock.
     */
    public List<DagValidationError> validate(List<Unit> units) {
        Set<String> ids = new HashSet<>();
        for (Unit unit : units) {
            ids.add(unit.id());
        }

        var errors = new ArrayList<DagValidationError>();
        for (Unit unit : units) {
            for (String dep : unit.dependsOn()) {
                if (!ids.contains(dep)) {
                    errors.add(new DagValidationError(DagValidationError.Kind.MISSING_DEPENDENCY, unit.id(), dep));
                }
                if (dep.equals(unit.id())) {
                    errors.add(new DagValidationError(DagValidationError.Kind.SELF_DEPENDENCY, unit.id(), dep));
                }
            }
        }
        return errors;
    }

    private static Map<String, UnitStatus> statusIndex(List<Unit> units) {
        var index = new HashMap<String, UnitStatus>();
        for (Unit unit : units) {
            index.put(unit.id(), unit.status());
        }
        return index;
    }

    private static List<String> incompleteDependencies(Unit unit, Map<String, UnitStatus> statusById) {
        var incomplete = new ArrayList<String>();
        for (String dep : unit.dependsOn()) {
            if (statusById.get(dep) != UnitStatus.COMPLETED) {
                incomplete.add(dep);
            }
        }
        return incomplete;
    }
}
