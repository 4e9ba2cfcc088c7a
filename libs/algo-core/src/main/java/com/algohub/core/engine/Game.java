package com.algohub.core.engine;

import com.algohub.core.card.Card;
import com.algohub.core.card.CardView;
import com.algohub.core.card.Talon;
import com.algohub.core.event.BoardChange;
import com.algohub.core.event.CardLocation;
import com.algohub.core.event.CardMovement;
import com.algohub.core.event.EventQueue;
import com.algohub.core.event.GameEvent;
import com.algohub.core.event.GameEventKind;
import com.algohub.core.event.ResponseKind;
import com.algohub.core.exception.GameSetupException;
import com.algohub.core.exception.NextEventException;
import com.algohub.core.exception.ProcessEventException;
import com.algohub.core.exception.UnknownPlayerException;
import com.algohub.core.player.Player;
import com.algohub.core.player.PlayerId;
import com.algohub.core.player.TurnPlayer;
import com.algohub.core.settings.GameSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 对局状态机（单一权威实例，只由一个线程驱动）。
 * <p>
 * 推进方式：
 * <ol>
 *   <li>{@link #nextEvent()} 从队列取出下一个事件并暂存，返回每个玩家视角下的副本；</li>
 *   <li>{@link #storePlayerResponse} 收集每个玩家的响应；</li>
 *   <li>{@link #processEvent()} 在收齐后校验并应用，随后清空响应、记入历史。</li>
 * </ol>
 * 暂存事件与队列互斥：暂存期间不会从队列取新事件。
 */
@Slf4j
public class Game {

    // static
    private final GameSettings settings;

    // board state
    private final Board board;

    // turn management
    private final TurnContext turn;

    // event management
    private GameEvent stagedEvent;
    private final EventQueue<GameEvent> eventQueue = new EventQueue<>();
    private final SortedMap<PlayerId, GameEvent> eventResponses = new TreeMap<>();
    private final List<GameEvent> history = new ArrayList<>();

    private Game(GameSettings settings, Board board, TurnContext turn, GameEvent firstEvent) {
        this.settings = settings;
        this.board = board;
        this.turn = turn;
        this.eventQueue.pushMain(firstEvent);
        for (PlayerId id : board.playerIds()) {
            eventResponses.put(id, null);
        }
    }

    /**
     * 创建两人对局，牌堆洗牌和行动顺序使用新的随机源。
     *
     * @throws GameSetupException 两个 ID 相同，或配置不合法
     */
    public static Game for2Players(PlayerId a, PlayerId b, GameSettings settings) {
        return for2Players(a, b, settings, new Random());
    }

    /**
     * 同 {@link #for2Players(PlayerId, PlayerId, GameSettings)}，随机源由调用方提供。
     */
    public static Game for2Players(PlayerId a, PlayerId b, GameSettings settings, Random rng) {
        if (a.equals(b)) {
            throw new GameSetupException("duplicated PlayerId: " + a);
        }

        Talon talon = new Talon(settings.buildCards());
        talon.shuffle(rng);

        Map<PlayerId, Player> players = Map.of(a, new Player(), b, new Player());

        List<PlayerId> order = new ArrayList<>(List.of(a, b));
        Collections.shuffle(order, rng);

        Game game = new Game(settings, new Board(talon, players), new TurnContext(new TurnPlayer(order)),
                new GameEvent.GameStarted(talon.view()));
        log.info("对局已创建: players={}, turnOrder={}, talon={}", players.keySet(), order, talon.size());
        return game;
    }

    /**
     * 指定玩家视角的盘面。
     *
     * @throws UnknownPlayerException 玩家不在本局中
     */
    public BoardView viewBoard(PlayerId viewer) {
        return board.view(viewer);
    }

    /**
     * 开始处理下一个事件。
     *
     * @return 每个玩家视角下的事件副本（按 PlayerId 排序）
     * @throws NextEventException 已有暂存事件（EVENT_PROCESSING）或队列已空（NO_MORE_EVENT）
     */
    public SortedMap<PlayerId, GameEvent> nextEvent() {
        if (stagedEvent != null) {
            throw new NextEventException(NextEventException.Reason.EVENT_PROCESSING);
        }
        GameEvent event = eventQueue.popNext()
                .orElseThrow(() -> new NextEventException(NextEventException.Reason.NO_MORE_EVENT));
        stagedEvent = event;
        log.debug("staged event: {}", event);

        SortedMap<PlayerId, GameEvent> views = new TreeMap<>();
        for (PlayerId id : eventResponses.keySet()) {
            views.put(id, event.view(id));
        }
        return views;
    }

    /**
     * 记录玩家对暂存事件的响应（同一玩家重复提交时覆盖）。
     *
     * @return 是否所有玩家都已响应
     * @throws UnknownPlayerException 玩家不在本局中
     */
    public boolean storePlayerResponse(PlayerId player, GameEvent response) {
        requireKnown(player);
        if (stagedEvent == null) {
            throw new IllegalStateException("no event is staged");
        }
        eventResponses.put(player, response);
        log.debug("response stored: player={}, response={}", player, response);
        return hasAllPlayersResponded();
    }

    /**
     * 丢弃某玩家已提交的响应，用于校验失败后重新询问。
     */
    public void discardResponse(PlayerId player) {
        requireKnown(player);
        eventResponses.put(player, null);
    }

    /**
     * 校验并应用暂存事件。校验失败时不修改任何状态，暂存事件和已收响应保持不变。
     *
     * @throws ProcessEventException 仍有玩家未响应（NOT_READY）或响应不合法（INVALID_RESPONSE）
     */
    public void processEvent() {
        if (stagedEvent == null || !hasAllPlayersResponded()) {
            throw ProcessEventException.notReady();
        }
        GameEvent decision = verifyResponses(stagedEvent);
        apply(stagedEvent, decision);
        finishEvent();
    }

    /**
     * 指定玩家对当前暂存事件应给出的响应种类：只有回合玩家需要做决策。
     */
    public ResponseKind expectedResponse(PlayerId player) {
        requireKnown(player);
        if (stagedEvent != null && stagedEvent.isDecisionRequired() && player.equals(turn.current())) {
            return ResponseKind.DECISION;
        }
        return ResponseKind.ACKNOWLEDGEMENT;
    }

    public GameSettings settings() {
        return settings;
    }

    public List<GameEvent> history() {
        return Collections.unmodifiableList(history);
    }

    public Optional<GameEvent> stagedEvent() {
        return Optional.ofNullable(stagedEvent);
    }

    public PlayerId currentTurnPlayer() {
        return turn.current();
    }

    public List<PlayerId> turnOrder() {
        return turn.turnPlayer().turnOrder();
    }

    public List<PlayerId> playerIds() {
        return List.copyOf(eventResponses.keySet());
    }

    /** 是否已处理过 GameEnded */
    public boolean isOver() {
        return !history.isEmpty() && history.get(history.size() - 1).kind() == GameEventKind.GAME_ENDED;
    }

    // ---------------------------------------------------------------- verify

    /**
     * 校验所有响应，返回回合玩家的决策（不需要决策时为 null）。
     */
    private GameEvent verifyResponses(GameEvent staged) {
        PlayerId turnPlayer = turn.current();
        GameEvent decision = null;
        for (Map.Entry<PlayerId, GameEvent> e : eventResponses.entrySet()) {
            PlayerId player = e.getKey();
            GameEvent response = e.getValue();
            if (staged.isDecisionRequired() && player.equals(turnPlayer)) {
                verifyDecision(staged, player, response);
                decision = response;
            } else if (response.kind() != GameEventKind.RESP_OK) {
                throw ProcessEventException.invalidResponse(player, GameEventKind.RESP_OK, response,
                        "acknowledgement expected");
            }
        }
        return decision;
    }

    private void verifyDecision(GameEvent staged, PlayerId player, GameEvent response) {
        GameEventKind expected = decisionKindFor(staged.kind());
        if (response.kind() != expected) {
            throw ProcessEventException.invalidResponse(player, expected, response, "wrong response kind");
        }
        switch (expected) {
            case ATTACK_TARGET_SELECTED -> {
                int idx = ((GameEvent.AttackTargetSelected) response).targetIdx();
                PlayerId target = ((GameEvent.AttackTargetSelectionRequired) staged).targetPlayer();
                Player targetPlayer = board.player(target);
                if (idx < 0 || idx >= targetPlayer.fieldSize()) {
                    throw ProcessEventException.invalidResponse(player, expected, response,
                            "target index out of range: " + idx);
                }
                if (targetPlayer.cardAt(idx).revealed()) {
                    throw ProcessEventException.invalidResponse(player, expected, response,
                            "target card is already revealed: " + idx);
                }
            }
            case NUMBER_GUESSED -> {
                int number = ((GameEvent.NumberGuessed) response).number();
                if (!settings.isValidNumber(number)) {
                    throw ProcessEventException.invalidResponse(player, expected, response,
                            "guessed number out of range: " + number);
                }
            }
            default -> {
                // AttackOrStayDecided 的两种取值都合法
            }
        }
    }

    private static GameEventKind decisionKindFor(GameEventKind required) {
        return switch (required) {
            case ATTACK_TARGET_SELECTION_REQUIRED -> GameEventKind.ATTACK_TARGET_SELECTED;
            case NUMBER_GUESS_REQUIRED -> GameEventKind.NUMBER_GUESSED;
            case ATTACK_OR_STAY_DECISION_REQUIRED -> GameEventKind.ATTACK_OR_STAY_DECIDED;
            default -> throw new IllegalStateException("no decision for " + required);
        };
    }

    // ---------------------------------------------------------------- apply

    private void apply(GameEvent staged, GameEvent decision) {
        PlayerId turnPlayer = turn.current();
        AttackContext attack = turn.attack();

        switch (staged.kind()) {
            case GAME_STARTED -> {
                log.info("对局开始，准备发牌: turnOrder={}", turnOrder());
                List<PlayerId> order = turnOrder();
                eventQueue.pushMain(new GameEvent.TurnOrderDetermined(order));
                for (int i = 0; i < settings.initialDrawNum(); i++) {
                    for (PlayerId id : order) {
                        eventQueue.pushMain(new GameEvent.CardDistributed(id));
                    }
                }
                eventQueue.pushMain(new GameEvent.TurnStarted(order.get(0)));
            }
            case CARD_DISTRIBUTED -> {
                PlayerId target = ((GameEvent.CardDistributed) staged).player();
                Card card = drawOrFail();
                int insertAt = board.player(target).insertCardToField(card);
                pushBoardChange(new BoardChange.CardMoved(target,
                        new CardMovement.TalonToField(insertAt), CardView.full(card)));
            }
            case TURN_STARTED -> eventQueue.pushMain(new GameEvent.TurnPlayerDrewCard());
            case TURN_PLAYER_DREW_CARD -> {
                Optional<Card> drawn = board.talon().draw();
                if (drawn.isEmpty()) {
                    eventQueue.pushMain(new GameEvent.NoCardsLeft());
                } else {
                    Card card = drawn.get();
                    board.player(turnPlayer).insertAttacker(card);
                    pushBoardChange(new BoardChange.CardMoved(turnPlayer,
                            new CardMovement.TalonToAttacker(), CardView.full(card)));
                    PlayerId opponent = opponentOf(turnPlayer);
                    attack.selectTargetPlayer(opponent);
                    eventQueue.pushMain(new GameEvent.AttackTargetSelectionRequired(opponent));
                }
            }
            case NO_CARDS_LEFT, ATTACKED_PLAYER_LOST -> eventQueue.pushMain(new GameEvent.GameEnded());
            case ATTACK_TARGET_SELECTION_REQUIRED -> {
                PlayerId target = ((GameEvent.AttackTargetSelectionRequired) staged).targetPlayer();
                attack.selectTargetPlayer(target);
                attack.selectTargetCard(((GameEvent.AttackTargetSelected) decision).targetIdx());
                eventQueue.pushMain(decision);
            }
            case ATTACK_TARGET_SELECTED -> eventQueue.pushMain(new GameEvent.NumberGuessRequired());
            case NUMBER_GUESS_REQUIRED -> {
                attack.guess(((GameEvent.NumberGuessed) decision).number());
                eventQueue.pushMain(decision);
            }
            case NUMBER_GUESSED -> {
                Card target = targetCard(attack);
                int guess = attack.guess()
                        .orElseThrow(() -> new IllegalStateException("guess is not set"));
                eventQueue.pushMain(target.number() == guess
                        ? new GameEvent.AttackSucceeded()
                        : new GameEvent.AttackFailed());
            }
            case ATTACK_SUCCEEDED -> {
                PlayerId targetId = attack.targetPlayer()
                        .orElseThrow(() -> new IllegalStateException("target player is not set"));
                int idx = attack.targetCardIdx()
                        .orElseThrow(() -> new IllegalStateException("target card is not set"));
                Player target = board.player(targetId);
                Card revealed = target.revealAt(idx);
                pushBoardChange(new BoardChange.CardRevealed(targetId,
                        new CardLocation.Field(idx), CardView.full(revealed)));
                if (target.isFieldAllRevealed()) {
                    log.info("玩家 {} 的手牌已全部翻开", targetId);
                    eventQueue.pushMain(new GameEvent.AttackedPlayerLost(targetId));
                } else {
                    eventQueue.pushMain(new GameEvent.AttackOrStayDecisionRequired());
                }
                attack.clearSelection();
            }
            case ATTACK_FAILED -> {
                Player self = board.player(turnPlayer);
                Card revealed = self.revealAttacker();
                pushBoardChange(new BoardChange.CardRevealed(turnPlayer,
                        new CardLocation.Attacker(), CardView.full(revealed)));
                int insertAt = self.foldAttackerIntoField();
                pushBoardChange(new BoardChange.CardMoved(turnPlayer,
                        new CardMovement.AttackerToField(insertAt), CardView.full(revealed)));
                eventQueue.pushMain(new GameEvent.TurnEnded());
            }
            case ATTACK_OR_STAY_DECISION_REQUIRED -> eventQueue.pushMain(decision);
            case ATTACK_OR_STAY_DECIDED -> {
                if (((GameEvent.AttackOrStayDecided) staged).attack()) {
                    PlayerId target = attack.targetPlayer().orElseGet(() -> opponentOf(turnPlayer));
                    eventQueue.pushMain(new GameEvent.AttackTargetSelectionRequired(target));
                } else {
                    Player self = board.player(turnPlayer);
                    Card card = self.attacker()
                            .orElseThrow(() -> new IllegalStateException("attacker does not exist"));
                    int insertAt = self.foldAttackerIntoField();
                    pushBoardChange(new BoardChange.CardMoved(turnPlayer,
                            new CardMovement.AttackerToField(insertAt), CardView.full(card)));
                    eventQueue.pushMain(new GameEvent.TurnEnded());
                }
            }
            case TURN_ENDED -> {
                turn.endTurn();
                eventQueue.pushMain(new GameEvent.TurnStarted(turn.current()));
            }
            case GAME_ENDED -> log.info("对局结束，共处理 {} 个事件", history.size() + 1);
            default -> {
                // BoardChanged / TurnOrderDetermined 只需确认
            }
        }
    }

    private void finishEvent() {
        history.add(stagedEvent);
        stagedEvent = null;
        eventResponses.replaceAll((id, resp) -> null);
    }

    // ---------------------------------------------------------------- helpers

    private void pushBoardChange(BoardChange change) {
        eventQueue.pushSub(new GameEvent.BoardChanged(change));
    }

    private Card drawOrFail() {
        return board.talon().draw()
                .orElseThrow(() -> new IllegalStateException("talon is empty while distributing cards"));
    }

    private Card targetCard(AttackContext attack) {
        PlayerId targetId = attack.targetPlayer()
                .orElseThrow(() -> new IllegalStateException("target player is not set"));
        int idx = attack.targetCardIdx()
                .orElseThrow(() -> new IllegalStateException("target card is not set"));
        return board.player(targetId).cardAt(idx);
    }

    private PlayerId opponentOf(PlayerId player) {
        return turnOrder().stream()
                .filter(id -> !id.equals(player))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("no opponent for " + player));
    }

    private boolean hasAllPlayersResponded() {
        return eventResponses.values().stream().allMatch(Objects::nonNull);
    }

    private void requireKnown(PlayerId player) {
        if (!eventResponses.containsKey(player)) {
            throw new UnknownPlayerException(player);
        }
    }
}
