package com.gt.flashcards.lifecycle.impl;

import com.gt.flashcards.lifecycle.DeckDao;
import com.gt.flashcards.util.IdUtil;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class DeckDaoPG implements DeckDao {

    private static final String LOAD_DECK_OWNER_SQL =
            "SELECT user_id FROM decks WHERE id = :deckId";

    private static final String LOAD_DECK_PATH_SQL =
            "WITH RECURSIVE deck_ancestors AS ( " +
            "    SELECT id, name, parent_id, 0 AS depth FROM decks WHERE id = :deckId " +
            "    UNION ALL " +
            "    SELECT d.id, d.name, d.parent_id, da.depth + 1 " +
            "    FROM decks d JOIN deck_ancestors da ON d.id = da.parent_id " +
            ") " +
            "SELECT name FROM deck_ancestors ORDER BY depth DESC";

    private final NamedParameterJdbcTemplate template;

    public DeckDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<String> loadDeckOwner(String deckId) {
        List<String> owners = template.queryForList(LOAD_DECK_OWNER_SQL, Map.of("deckId", IdUtil.toUuid(deckId)), String.class);

        return owners.isEmpty() ? Optional.empty() : Optional.of(owners.get(0));
    }

    @Override
    public List<String> loadDeckPath(String deckId) {
        return template.queryForList(LOAD_DECK_PATH_SQL, Map.of("deckId", IdUtil.toUuid(deckId)), String.class);
    }
}
