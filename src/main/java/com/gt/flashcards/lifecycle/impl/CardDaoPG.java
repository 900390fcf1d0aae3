package com.gt.flashcards.lifecycle.impl;

import com.gt.flashcards.lifecycle.CardDao;
import com.gt.flashcards.model.*;
import com.gt.flashcards.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class CardDaoPG implements CardDao {

    private static final Logger log = LoggerFactory.getLogger(CardDaoPG.class);

    private static final String CARD_COLUMNS =
            "c.id, c.note_id, c.deck_id, d.user_id AS owner, c.template_ordinal, " +
            "c.card_type, c.due, c.interval_days, c.stability, c.difficulty, c.reps, c.lapses, c.last_review_at, " +
            "c.suspended, c.suspended_at, c.suspended_by, c.resume_date, c.pause_reason, " +
            "c.flag, CAST(c.custom_data ->> '" + POSITION_KEY + "' AS int) AS position, c.created_at, c.updated_at ";

    private static final String LOAD_CARD_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM cards c JOIN decks d ON c.deck_id = d.id " +
            "WHERE c.id = :cardId";

    private static final String LOAD_CARD_FOR_UPDATE_SQL = LOAD_CARD_SQL + " FOR UPDATE OF c";

    private static final String LOAD_CARDS_FOR_NOTE_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM cards c JOIN decks d ON c.deck_id = d.id " +
            "WHERE c.note_id = :noteId " +
            "ORDER BY c.template_ordinal";

    private static final String LOAD_CARD_TYPES_FOR_UPDATE_SQL =
            "SELECT id, card_type FROM cards WHERE id IN (:cardIds) FOR UPDATE";

    private static final String PROMOTE_NEW_CARD_SQL =
            "UPDATE cards " +
            "SET due = :due, card_type = 'review', interval_days = :intervalDays, updated_at = NOW() " +
            "WHERE id = :cardId";

    private static final String UPDATE_DUE_SQL =
            "UPDATE cards SET due = :due, updated_at = NOW() WHERE id = :cardId";

    private static final String PROMOTE_NEW_CARDS_SQL =
            "UPDATE cards " +
            "SET due = :due, card_type = 'review', interval_days = :intervalDays, updated_at = NOW() " +
            "WHERE id IN (:cardIds) AND card_type = 'new'";

    private static final String UPDATE_DUE_FOR_NON_NEW_CARDS_SQL =
            "UPDATE cards " +
            "SET due = :due, updated_at = NOW() " +
            "WHERE id IN (:cardIds) AND card_type != 'new'";

    private static final String RESET_TO_NEW_SQL =
            "UPDATE cards " +
            "SET card_type = 'new', due = NULL, interval_days = 0, stability = 0, difficulty = 0, " +
            "    reps = 0, lapses = 0, last_review_at = NULL, updated_at = NOW() " +
            "WHERE id IN (:cardIds)";

    private static final String UPDATE_POSITION_SQL =
            "UPDATE cards " +
            "SET custom_data = jsonb_set(COALESCE(custom_data, CAST('{}' AS jsonb)), '{" + POSITION_KEY + "}', to_jsonb(CAST(:position AS int))), " +
            "    updated_at = NOW() " +
            "WHERE id = :cardId";

    private static final String UPDATE_SCHEDULING_STATE_SQL =
            "UPDATE cards " +
            "SET card_type = :cardType, due = :due, interval_days = :intervalDays, stability = :stability, difficulty = :difficulty, " +
            "    reps = :reps, lapses = :lapses, last_review_at = :lastReviewAt, updated_at = NOW() " +
            "WHERE id = :cardId";

    private static final String CREATE_NEW_CARD_SQL =
            "INSERT INTO cards (id, note_id, deck_id, template_ordinal, card_type, due, interval_days, stability, difficulty, " +
            "                   last_review_at, reps, lapses, flag, suspended, custom_data) " +
            "VALUES (:cardId, :noteId, :deckId, :templateOrdinal, 'new', NULL, 0, 0, 0, NULL, 0, 0, 0, false, CAST('{}' AS jsonb))";

    private static final String UPDATE_FLAG_SQL =
            "UPDATE cards SET flag = :flag, updated_at = NOW() WHERE id = :cardId";

    private final NamedParameterJdbcTemplate template;

    public CardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<Card> loadCard(String cardId) {
        return querySingleCard(LOAD_CARD_SQL, cardId);
    }

    @Override
    public Optional<Card> loadCardForUpdate(String cardId) {
        return querySingleCard(LOAD_CARD_FOR_UPDATE_SQL, cardId);
    }

    private Optional<Card> querySingleCard(String sql, String cardId) {
        List<Card> cards = template.query(sql, Map.of("cardId", IdUtil.toUuid(cardId)), CardDaoPG::getCardFromResultSet);

        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(0));
    }

    @Override
    public List<Card> loadCardsForNote(String noteId) {
        return template.query(LOAD_CARDS_FOR_NOTE_SQL, Map.of("noteId", IdUtil.toUuid(noteId)), CardDaoPG::getCardFromResultSet);
    }

    @Override
    public Map<String, CardType> loadCardTypesForUpdate(Collection<String> cardIds) {
        if (cardIds.isEmpty()) {
            return Map.of();
        }

        Map<String, CardType> cardTypes = new HashMap<>();
        template.query(LOAD_CARD_TYPES_FOR_UPDATE_SQL, Map.of("cardIds", IdUtil.toUuids(cardIds)), rs -> {
            cardTypes.put(rs.getString("id"), CardType.fromDbValue(rs.getString("card_type")));
        });

        return cardTypes;
    }

    @Override
    public int promoteNewCard(String cardId, Instant due, int intervalDays) {
        return template.update(PROMOTE_NEW_CARD_SQL, Map.of(
                "cardId", IdUtil.toUuid(cardId),
                "due", Timestamp.from(due),
                "intervalDays", intervalDays));
    }

    @Override
    public int updateDue(String cardId, Instant due) {
        return template.update(UPDATE_DUE_SQL, Map.of(
                "cardId", IdUtil.toUuid(cardId),
                "due", Timestamp.from(due)));
    }

    @Override
    public int promoteNewCards(Collection<String> cardIds, Instant due, int intervalDays) {
        return template.update(PROMOTE_NEW_CARDS_SQL, Map.of(
                "cardIds", IdUtil.toUuids(cardIds),
                "due", Timestamp.from(due),
                "intervalDays", intervalDays));
    }

    @Override
    public int updateDueForNonNewCards(Collection<String> cardIds, Instant due) {
        return template.update(UPDATE_DUE_FOR_NON_NEW_CARDS_SQL, Map.of(
                "cardIds", IdUtil.toUuids(cardIds),
                "due", Timestamp.from(due)));
    }

    @Override
    public int resetToNew(Collection<String> cardIds) {
        if (cardIds.isEmpty()) {
            return 0;
        }

        return template.update(RESET_TO_NEW_SQL, Map.of("cardIds", IdUtil.toUuids(cardIds)));
    }

    @Override
    public void updatePositions(List<String> cardIds, List<Integer> positions) {
        SqlParameterSource paramsArray[] = new SqlParameterSource[cardIds.size()];

        for (int index = 0; index < cardIds.size(); index++) {
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "cardId", IdUtil.toUuid(cardIds.get(index)),
                    "position", positions.get(index)));
        }

        template.batchUpdate(UPDATE_POSITION_SQL, paramsArray);
        log.debug("Repositioned {} new cards", cardIds.size());
    }

    @Override
    public int updateSchedulingState(String cardId, SchedulingState schedulingState) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cardId", IdUtil.toUuid(cardId));
        params.addValue("cardType", schedulingState.cardType().getDbValue());
        params.addValue("due", toTimestamp(schedulingState.due()));
        params.addValue("intervalDays", schedulingState.intervalDays());
        params.addValue("stability", schedulingState.stability());
        params.addValue("difficulty", schedulingState.difficulty());
        params.addValue("reps", schedulingState.reps());
        params.addValue("lapses", schedulingState.lapses());
        params.addValue("lastReviewAt", toTimestamp(schedulingState.lastReviewAt()));

        return template.update(UPDATE_SCHEDULING_STATE_SQL, params);
    }

    @Override
    public void createNewCard(String cardId, String noteId, String deckId, int templateOrdinal) {
        template.update(CREATE_NEW_CARD_SQL, Map.of(
                "cardId", IdUtil.toUuid(cardId),
                "noteId", IdUtil.toUuid(noteId),
                "deckId", IdUtil.toUuid(deckId),
                "templateOrdinal", templateOrdinal));
    }

    @Override
    public int updateFlag(String cardId, int flag) {
        return template.update(UPDATE_FLAG_SQL, Map.of("cardId", IdUtil.toUuid(cardId), "flag", flag));
    }

    static Card getCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        SchedulingState schedulingState = new SchedulingState(
                CardType.fromDbValue(rs.getString("card_type")),
                toInstant(rs.getTimestamp("due")),
                rs.getInt("interval_days"),
                rs.getDouble("stability"),
                rs.getDouble("difficulty"),
                rs.getInt("reps"),
                rs.getInt("lapses"),
                toInstant(rs.getTimestamp("last_review_at")));

        Date resumeDate = rs.getDate("resume_date");
        SuspensionState suspensionState = new SuspensionState(
                rs.getBoolean("suspended"),
                toInstant(rs.getTimestamp("suspended_at")),
                SuspensionSource.fromDbValue(rs.getString("suspended_by")),
                resumeDate == null ? null : resumeDate.toLocalDate(),
                rs.getString("pause_reason"));

        int position = rs.getInt("position");
        Integer newQueuePosition = rs.wasNull() ? null : position;

        return new Card(
                rs.getString("id"),
                rs.getString("note_id"),
                rs.getString("deck_id"),
                rs.getString("owner"),
                rs.getInt("template_ordinal"),
                schedulingState,
                suspensionState,
                rs.getInt("flag"),
                newQueuePosition,
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
