package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CrmRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.EnumSet;

/**
 * The fixed set of moves a campaign may make. Each source stage has at most one entry,
 * so a record's next stage is fully determined by its current one.
 */
public class TransitionTable {

    private final Map<StageKey, Transition> bySource = new EnumMap<>(StageKey.class);
    private final StageCatalog stages;

    public TransitionTable(StageCatalog stages, List<Transition> transitions) {
        this.stages = stages;
        for (Transition transition : transitions) {
            if (transition.getFrom() == transition.getTo()) {
                throw new IllegalArgumentException("Transition " + transition + " does not change stage");
            }
            if (bySource.putIfAbsent(transition.getFrom(), transition) != null) {
                throw new IllegalArgumentException("Stage " + transition.getFrom() + " has more than one transition");
            }
        }
    }

    public Optional<Transition> find(CrmRecord record) {
        return stages.stageOf(record).map(bySource::get);
    }

    public boolean hasEntryFor(CrmRecord record) {
        return find(record).isPresent();
    }

    public List<Transition> transitions() {
        return Collections.unmodifiableList(new ArrayList<>(bySource.values()));
    }

    /**
     * Every stage referenced by the table, as source or target.
     */
    public Set<StageKey> referencedStages() {
        Set<StageKey> keys = EnumSet.noneOf(StageKey.class);
        for (Transition transition : bySource.values()) {
            keys.add(transition.getFrom());
            keys.add(transition.getTo());
        }
        return keys;
    }
}
