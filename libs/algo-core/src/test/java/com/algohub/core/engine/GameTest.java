package com.algohub.core.engine;

import com.algohub.core.card.CardColor;
import com.algohub.core.card.CardView;
import com.algohub.core.event.BoardChange;
import com.algohub.core.event.CardLocation;
import com.algohub.core.event.GameEvent;
import com.algohub.core.event.GameEventKind;
import com.algohub.core.event.ResponseKind;
import com.algohub.core.exception.GameSetupException;
import com.algohub.core.exception.NextEventException;
import com.algohub.core.exception.ProcessEventException;
import com.algohub.core.exception.UnknownPlayerException;
import com.algohub.core.player.PlayerId;
import com.algohub.core.settings.GameSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameTest {

    private static final PlayerId P1 = PlayerId.of(1);
    private static final PlayerId P2 = PlayerId.of(2);

    private Game game;
    private GameDriver driver;

    @BeforeEach
    void setUp() {
        game = Game.for2Players(P1, P2, GameSettings.defaults(), new Random(42));
        driver = new GameDriver(game);
    }

    @Test
    @DisplayName("两人默认配置：牌堆 24 张，发完初始手牌后剩 16 张")
    void dealsInitialHands() {
        assertThat(game.viewBoard(P1).talonRemaining()).isEqualTo(24);
        assertThat(game.turnOrder()).containsExactlyInAnyOrder(P1, P2);

        GameEvent started = driver.advanceUntil(GameEventKind.TURN_STARTED);

        assertThat(((GameEvent.TurnStarted) started).player()).isEqualTo(game.turnOrder().get(0));
        assertThat(game.viewBoard(P1).talonRemaining()).isEqualTo(16);
        assertThat(game.viewBoard(P1).myself().field()).hasSize(4);
        assertThat(game.viewBoard(P2).myself().field()).hasSize(4);
    }

    @Test
    void firstEventCarriesTalonView() {
        GameEvent first = driver.stageNext();

        assertThat(first).isInstanceOf(GameEvent.GameStarted.class);
        GameEvent.GameStarted started = (GameEvent.GameStarted) first;
        assertThat(started.talon().cardsRemaining()).isEqualTo(24);
        assertThat(started.talon().colors()).hasSize(24)
                .filteredOn(c -> c == CardColor.BLACK).hasSize(12);
    }

    @Test
    void fieldsStaySortedAfterDealing() {
        driver.advanceUntil(GameEventKind.TURN_STARTED);

        for (PlayerId id : List.of(P1, P2)) {
            List<CardView> field = game.viewBoard(id).myself().field();
            for (int i = 1; i < field.size(); i++) {
                CardView prev = field.get(i - 1);
                CardView cur = field.get(i);
                int byNumber = Integer.compare(prev.privInfo().number(), cur.privInfo().number());
                assertThat(byNumber < 0 || (byNumber == 0 && prev.pubInfo().color().compareTo(cur.pubInfo().color()) < 0))
                        .as("field of %s is sorted at %d", id, i)
                        .isTrue();
            }
        }
    }

    @Test
    @DisplayName("发牌的盘面变化：持有者看得到数字，对手看不到")
    void dealtCardIsRedactedForOpponent() {
        driver.advanceUntil(GameEventKind.CARD_DISTRIBUTED);
        PlayerId receiver = ((GameEvent.CardDistributed) game.stagedEvent().orElseThrow()).player();
        driver.ackAll();

        GameEvent next = driver.stageNext();
        assertThat(next.kind()).isEqualTo(GameEventKind.BOARD_CHANGED);

        SortedMap<PlayerId, GameEvent> views = driver.lastViews();
        BoardChange mine = ((GameEvent.BoardChanged) views.get(receiver)).change();
        BoardChange theirs = ((GameEvent.BoardChanged) views.get(driver.opponentOf(receiver))).change();
        assertThat(mine.card().hasNumber()).isTrue();
        assertThat(theirs.card().hasNumber()).isFalse();
        assertThat(theirs.card().pubInfo()).isEqualTo(mine.card().pubInfo());
    }

    @Test
    void opponentBoardViewHidesNumbers() {
        driver.advanceUntil(GameEventKind.TURN_STARTED);

        BoardView view = game.viewBoard(P1);
        assertThat(view.myself().id()).isEqualTo(P1);
        assertThat(view.myself().field()).allMatch(CardView::hasNumber);
        assertThat(view.otherPlayers()).hasSize(1);
        assertThat(view.otherPlayers().get(0).id()).isEqualTo(P2);
        assertThat(view.otherPlayers().get(0).field()).noneMatch(CardView::hasNumber);
        assertThat(view.talonTop()).isNotNull();
        assertThat(view.talonTop().hasNumber()).isFalse();
    }

    @Test
    @DisplayName("猜中：对手下标 2 的牌被翻开")
    void correctGuessRevealsTargetCard() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        PlayerId target = driver.opponentOf(attacker);
        int number = driver.numberAt(target, 2);

        driver.decide(new GameEvent.AttackTargetSelected(2));
        driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);
        driver.decide(new GameEvent.NumberGuessed(number));

        GameEvent result = driver.advanceUntil(GameEventKind.ATTACK_SUCCEEDED);
        assertThat(result).isEqualTo(new GameEvent.AttackSucceeded());
        driver.ackAll();

        GameEvent revealed = driver.stageNext();
        BoardChange change = ((GameEvent.BoardChanged) revealed).change();
        assertThat(change).isInstanceOf(BoardChange.CardRevealed.class);
        assertThat(((BoardChange.CardRevealed) change).location()).isEqualTo(new CardLocation.Field(2));
        assertThat(driver.lastViews().get(attacker)).isEqualTo(revealed);
        driver.ackAll();

        assertThat(game.viewBoard(target).myself().field().get(2).pubInfo().revealed()).isTrue();
        CardView seenByAttacker = game.viewBoard(attacker).otherPlayers().get(0).field().get(2);
        assertThat(seenByAttacker.privInfo().number()).isEqualTo(number);

        assertThat(driver.stageNext().kind()).isEqualTo(GameEventKind.ATTACK_OR_STAY_DECISION_REQUIRED);
    }

    @Test
    @DisplayName("猜错：抽到的牌翻开并收进自己的手牌区，回合交给对手")
    void wrongGuessFoldsAttackerAndPassesTurn() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        PlayerId target = driver.opponentOf(attacker);
        CardView drawn = game.viewBoard(attacker).myself().attacker();
        assertThat(drawn).isNotNull();
        int wrong = (driver.numberAt(target, 2) + 1) % (GameSettings.MAX_CARD_NUM_DEFAULT + 1);

        driver.decide(new GameEvent.AttackTargetSelected(2));
        driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);
        driver.decide(new GameEvent.NumberGuessed(wrong));
        driver.advanceUntil(GameEventKind.ATTACK_FAILED);
        driver.ackAll();

        GameEvent first = driver.stageNext();
        assertThat(((GameEvent.BoardChanged) first).change())
                .isInstanceOf(BoardChange.CardRevealed.class)
                .extracting(BoardChange::player).isEqualTo(attacker);
        driver.ackAll();
        GameEvent second = driver.stageNext();
        assertThat(((GameEvent.BoardChanged) second).change()).isInstanceOf(BoardChange.CardMoved.class);
        driver.ackAll();

        GameEvent started = driver.advanceUntil(GameEventKind.TURN_STARTED);
        assertThat(((GameEvent.TurnStarted) started).player()).isEqualTo(target);
        assertThat(game.currentTurnPlayer()).isEqualTo(target);

        BoardView attackerView = game.viewBoard(attacker);
        assertThat(attackerView.myself().attacker()).isNull();
        assertThat(attackerView.myself().field()).hasSize(5)
                .anySatisfy(c -> {
                    assertThat(c.pubInfo().revealed()).isTrue();
                    assertThat(c.pubInfo().color()).isEqualTo(drawn.pubInfo().color());
                    assertThat(c.privInfo()).isEqualTo(drawn.privInfo());
                });
        assertThat(game.viewBoard(target).myself().field().get(2).pubInfo().revealed()).isFalse();
    }

    @Test
    @DisplayName("停手：抽到的牌以背面朝上收进手牌区")
    void stayFoldsAttackerFaceDown() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        PlayerId target = driver.opponentOf(attacker);

        driver.decide(new GameEvent.AttackTargetSelected(0));
        driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);
        driver.decide(new GameEvent.NumberGuessed(driver.numberAt(target, 0)));
        driver.advanceUntil(GameEventKind.ATTACK_OR_STAY_DECISION_REQUIRED);
        driver.decide(new GameEvent.AttackOrStayDecided(false));

        driver.advanceUntil(GameEventKind.TURN_STARTED);
        List<CardView> field = game.viewBoard(attacker).myself().field();
        assertThat(field).hasSize(5);
        assertThat(field).filteredOn(c -> c.pubInfo().revealed()).isEmpty();
        assertThat(game.currentTurnPlayer()).isEqualTo(target);
    }

    @Test
    @DisplayName("对手 4 张牌全部被翻开：AttackedPlayerLost → GameEnded")
    void revealingWholeFieldEndsGame() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        PlayerId target = driver.opponentOf(attacker);

        for (int i = 0; i < 4; i++) {
            if (i > 0) {
                driver.advanceUntil(GameEventKind.ATTACK_OR_STAY_DECISION_REQUIRED);
                driver.decide(new GameEvent.AttackOrStayDecided(true));
                GameEvent again = driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
                assertThat(((GameEvent.AttackTargetSelectionRequired) again).targetPlayer()).isEqualTo(target);
            }
            int idx = driver.firstHiddenIdx(target);
            driver.decide(new GameEvent.AttackTargetSelected(idx));
            driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);
            driver.decide(new GameEvent.NumberGuessed(driver.numberAt(target, idx)));
        }

        GameEvent lost = driver.advanceUntil(GameEventKind.ATTACKED_PLAYER_LOST);
        assertThat(lost).isEqualTo(new GameEvent.AttackedPlayerLost(target));
        assertThat(game.viewBoard(target).myself().field()).allMatch(c -> c.pubInfo().revealed());
        assertThat(game.viewBoard(P1).talonRemaining()).isGreaterThan(0);
        driver.ackAll();

        driver.advanceUntil(GameEventKind.GAME_ENDED);
        assertThat(game.isOver()).isFalse();
        driver.ackAll();

        assertThat(game.isOver()).isTrue();
        assertThatThrownBy(game::nextEvent)
                .isInstanceOf(NextEventException.class)
                .extracting(e -> ((NextEventException) e).getReason())
                .isEqualTo(NextEventException.Reason.NO_MORE_EVENT);
    }

    @Test
    @DisplayName("牌堆抽空：NoCardsLeft → GameEnded")
    void emptyTalonEndsInDraw() {
        int maxNumber = GameSettings.MAX_CARD_NUM_DEFAULT + 1;
        boolean noCardsLeft = false;
        int targetIdx = -1;
        PlayerId target = null;

        for (int step = 0; step < 5_000 && !game.isOver(); step++) {
            GameEvent staged = driver.stageNext();
            switch (staged.kind()) {
                case ATTACK_TARGET_SELECTION_REQUIRED -> {
                    target = ((GameEvent.AttackTargetSelectionRequired) staged).targetPlayer();
                    targetIdx = driver.firstHiddenIdx(target);
                    driver.decide(new GameEvent.AttackTargetSelected(targetIdx));
                }
                case NUMBER_GUESS_REQUIRED ->
                        driver.decide(new GameEvent.NumberGuessed((driver.numberAt(target, targetIdx) + 1) % maxNumber));
                case NO_CARDS_LEFT -> {
                    noCardsLeft = true;
                    assertThat(game.viewBoard(P1).talonRemaining()).isZero();
                    driver.ackAll();
                }
                case GAME_ENDED -> {
                    assertThat(noCardsLeft).isTrue();
                    driver.ackAll();
                }
                default -> driver.ackAll();
            }
        }

        assertThat(game.isOver()).isTrue();
        assertThat(game.viewBoard(P1).myself().field().size() + game.viewBoard(P2).myself().field().size())
                .isEqualTo(24);
        List<GameEvent> history = game.history();
        assertThat(history.get(history.size() - 2)).isEqualTo(new GameEvent.NoCardsLeft());
    }

    @Test
    @DisplayName("N 个玩家各结束一次回合后行动顺序复原")
    void turnOrderRotatesBack() {
        List<PlayerId> before = game.turnOrder();
        int turnsEnded = 0;
        int targetIdx = -1;
        PlayerId target = null;

        while (turnsEnded < 2) {
            GameEvent staged = driver.stageNext();
            switch (staged.kind()) {
                case ATTACK_TARGET_SELECTION_REQUIRED -> {
                    target = ((GameEvent.AttackTargetSelectionRequired) staged).targetPlayer();
                    targetIdx = driver.firstHiddenIdx(target);
                    driver.decide(new GameEvent.AttackTargetSelected(targetIdx));
                }
                case NUMBER_GUESS_REQUIRED ->
                        driver.decide(new GameEvent.NumberGuessed((driver.numberAt(target, targetIdx) + 1) % 12));
                case TURN_ENDED -> {
                    driver.ackAll();
                    turnsEnded++;
                    if (turnsEnded == 1) {
                        assertThat(game.turnOrder()).containsExactly(before.get(1), before.get(0));
                    }
                }
                default -> driver.ackAll();
            }
        }
        assertThat(game.turnOrder()).isEqualTo(before);
    }

    // ---------------------------------------------------------------- sequencing

    @Test
    void nextEventWhileStagedFails() {
        driver.stageNext();

        assertThatThrownBy(game::nextEvent)
                .isInstanceOf(NextEventException.class)
                .extracting(e -> ((NextEventException) e).getReason())
                .isEqualTo(NextEventException.Reason.EVENT_PROCESSING);
    }

    @Test
    void processBeforeAllRespondedFails() {
        driver.stageNext();
        assertThatThrownBy(game::processEvent)
                .isInstanceOf(ProcessEventException.class)
                .extracting(e -> ((ProcessEventException) e).getReason())
                .isEqualTo(ProcessEventException.Reason.NOT_READY);

        assertThat(game.storePlayerResponse(P1, new GameEvent.RespOk())).isFalse();
        assertThatThrownBy(game::processEvent).isInstanceOf(ProcessEventException.class);

        assertThat(game.storePlayerResponse(P2, new GameEvent.RespOk())).isTrue();
        game.processEvent();
        assertThat(game.history()).hasSize(1);
        assertThat(game.stagedEvent()).isEmpty();
    }

    @Test
    void unknownPlayerIsRejected() {
        driver.stageNext();
        PlayerId stranger = PlayerId.of(99);

        assertThatThrownBy(() -> game.storePlayerResponse(stranger, new GameEvent.RespOk()))
                .isInstanceOf(UnknownPlayerException.class);
        assertThatThrownBy(() -> game.viewBoard(stranger))
                .isInstanceOf(UnknownPlayerException.class);
    }

    @Test
    void onlyTurnPlayerOwesDecision() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();

        assertThat(game.expectedResponse(attacker)).isEqualTo(ResponseKind.DECISION);
        assertThat(game.expectedResponse(driver.opponentOf(attacker))).isEqualTo(ResponseKind.ACKNOWLEDGEMENT);
    }

    // ---------------------------------------------------------------- invalid responses

    @Test
    void decisionForAcknowledgementIsInvalid() {
        driver.stageNext();
        game.storePlayerResponse(P1, new GameEvent.NumberGuessed(3));
        game.storePlayerResponse(P2, new GameEvent.RespOk());

        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ProcessEventException.Reason.INVALID_RESPONSE);
                    assertThat(e.getPlayer()).isEqualTo(P1);
                    assertThat(e.getExpected()).isEqualTo(GameEventKind.RESP_OK);
                    assertThat(e.getActual()).isEqualTo(new GameEvent.NumberGuessed(3));
                });
        assertThat(game.stagedEvent()).isPresent();
        assertThat(game.history()).isEmpty();
    }

    @Test
    void outOfRangeTargetIsInvalidAndNothingChanges() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        int historySize = game.history().size();
        BoardView before = game.viewBoard(attacker);

        driver.storeDecision(new GameEvent.AttackTargetSelected(4));
        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class, e -> {
                    assertThat(e.getPlayer()).isEqualTo(attacker);
                    assertThat(e.getExpected()).isEqualTo(GameEventKind.ATTACK_TARGET_SELECTED);
                });
        assertThat(game.history()).hasSize(historySize);
        assertThat(game.viewBoard(attacker)).isEqualTo(before);

        // 重新询问后可以继续
        game.discardResponse(attacker);
        assertThatThrownBy(game::processEvent).isInstanceOf(ProcessEventException.class)
                .extracting(e -> ((ProcessEventException) e).getReason())
                .isEqualTo(ProcessEventException.Reason.NOT_READY);
        assertThat(game.storePlayerResponse(attacker, new GameEvent.AttackTargetSelected(1))).isTrue();
        game.processEvent();
        assertThat(driver.stageNext()).isEqualTo(new GameEvent.AttackTargetSelected(1));
    }

    @Test
    void revealedTargetIsInvalid() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId target = driver.opponentOf(game.currentTurnPlayer());
        driver.decide(new GameEvent.AttackTargetSelected(0));
        driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);
        driver.decide(new GameEvent.NumberGuessed(driver.numberAt(target, 0)));
        driver.advanceUntil(GameEventKind.ATTACK_OR_STAY_DECISION_REQUIRED);
        driver.decide(new GameEvent.AttackOrStayDecided(true));
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);

        driver.storeDecision(new GameEvent.AttackTargetSelected(0));
        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class,
                        e -> assertThat(e.getMessage()).contains("already revealed"));
    }

    @Test
    void guessOutOfRangeIsInvalid() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        driver.decide(new GameEvent.AttackTargetSelected(0));
        driver.advanceUntil(GameEventKind.NUMBER_GUESS_REQUIRED);

        driver.storeDecision(new GameEvent.NumberGuessed(12));
        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class,
                        e -> assertThat(e.getExpected()).isEqualTo(GameEventKind.NUMBER_GUESSED));

        game.discardResponse(game.currentTurnPlayer());
        driver.storeDecision(new GameEvent.NumberGuessed(-1));
        assertThatThrownBy(game::processEvent).isInstanceOf(ProcessEventException.class);
    }

    @Test
    void wrongDecisionKindIsInvalid() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);

        driver.storeDecision(new GameEvent.RespOk());
        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(GameEventKind.ATTACK_TARGET_SELECTED);
                    assertThat(e.getActual()).isEqualTo(new GameEvent.RespOk());
                });
    }

    @Test
    void decisionFromNonTurnPlayerIsInvalid() {
        driver.advanceUntil(GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED);
        PlayerId attacker = game.currentTurnPlayer();
        PlayerId other = driver.opponentOf(attacker);

        game.storePlayerResponse(attacker, new GameEvent.AttackTargetSelected(0));
        game.storePlayerResponse(other, new GameEvent.AttackTargetSelected(0));
        assertThatThrownBy(game::processEvent)
                .isInstanceOfSatisfying(ProcessEventException.class,
                        e -> assertThat(e.getPlayer()).isEqualTo(other));
    }

    // ---------------------------------------------------------------- setup

    @Test
    void duplicatedPlayerIdsAreRejected() {
        assertThatThrownBy(() -> Game.for2Players(P1, P1, GameSettings.defaults()))
                .isInstanceOf(GameSetupException.class)
                .hasMessageContaining("duplicated PlayerId");
    }

    @Test
    void tooFewCardsForInitialDrawAreRejected() {
        GameSettings settings = new GameSettings(List.of(CardColor.BLACK, CardColor.WHITE), 11, 12);

        assertThatThrownBy(() -> Game.for2Players(P1, P2, settings))
                .isInstanceOf(GameSetupException.class)
                .hasMessageContaining("not enough cards");
    }

    @Test
    void invalidSettingsAreRejected() {
        GameSettings oneColor = new GameSettings(List.of(CardColor.BLACK), 11, 4);
        GameSettings lowMax = new GameSettings(List.of(CardColor.BLACK, CardColor.WHITE), 10, 4);

        assertThatThrownBy(() -> Game.for2Players(P1, P2, oneColor)).isInstanceOf(GameSetupException.class);
        assertThatThrownBy(() -> Game.for2Players(P1, P2, lowMax)).isInstanceOf(GameSetupException.class);
    }
}
