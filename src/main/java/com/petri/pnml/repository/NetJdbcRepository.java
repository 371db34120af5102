package com.petri.pnml.repository;

import com.petri.pnml.domain.NetModels.Arc;
import com.petri.pnml.domain.NetModels.Place;
import com.petri.pnml.domain.NetModels.Transition;
import com.petri.pnml.domain.PetriNet;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class NetJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public NetJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void save(String netId, PetriNet net) {
        jdbcTemplate.update("INSERT INTO pn_nets(net_id, imported_at) VALUES (?,?)", netId, Instant.now().toString());

        List<Place> places = new ArrayList<>(net.places().values());
        for (int i = 0; i < places.size(); i++) {
            Place p = places.get(i);
            jdbcTemplate.update("INSERT INTO pn_places(net_id, pos, place_id, name, initial_marking) VALUES (?,?,?,?,?)",
                    netId, i, p.id(), p.name(), p.initialMarking());
        }

        List<Transition> transitions = new ArrayList<>(net.transitions().values());
        for (int i = 0; i < transitions.size(); i++) {
            Transition t = transitions.get(i);
            jdbcTemplate.update("INSERT INTO pn_transitions(net_id, pos, transition_id, name) VALUES (?,?,?,?)",
                    netId, i, t.id(), t.name());
        }

        List<Arc> arcs = net.arcs();
        for (int i = 0; i < arcs.size(); i++) {
            Arc a = arcs.get(i);
            jdbcTemplate.update("INSERT INTO pn_arcs(net_id, pos, arc_id, source_id, target_id) VALUES (?,?,?,?,?)",
                    netId, i, a.id(), a.source(), a.target());
        }
    }

    public boolean exists(String netId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM pn_nets WHERE net_id = ?", Integer.class, netId);
        return count != null && count > 0;
    }

    public Optional<PetriNet> load(String netId) {
        if (!exists(netId)) return Optional.empty();

        PetriNet net = new PetriNet();
        jdbcTemplate.query(
                "SELECT place_id, name, initial_marking FROM pn_places WHERE net_id = ? ORDER BY pos",
                (rs, n) -> new Place(rs.getString(1), rs.getString(2), rs.getLong(3)),
                netId).forEach(net::addPlace);
        jdbcTemplate.query(
                "SELECT transition_id, name FROM pn_transitions WHERE net_id = ? ORDER BY pos",
                (rs, n) -> new Transition(rs.getString(1), rs.getString(2)),
                netId).forEach(net::addTransition);
        jdbcTemplate.query(
                "SELECT arc_id, source_id, target_id FROM pn_arcs WHERE net_id = ? ORDER BY pos",
                (rs, n) -> new Arc(rs.getString(1), rs.getString(2), rs.getString(3)),
                netId).forEach(net::addArc);
        return Optional.of(net);
    }
}
