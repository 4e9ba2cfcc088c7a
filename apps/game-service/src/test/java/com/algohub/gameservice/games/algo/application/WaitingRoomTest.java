package com.algohub.gameservice.games.algo.application;

import com.algohub.core.card.CardColor;
import com.algohub.core.exception.GameSetupException;
import com.algohub.core.player.PlayerId;
import com.algohub.core.settings.GameSettings;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.EventId;
import com.algohub.protocol.message.ClientToServerEvent;
import com.algohub.protocol.message.JoinInfo;
import com.algohub.protocol.message.JoinedPlayerInfo;
import com.algohub.protocol.message.ServerToClientEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaitingRoomTest {

    private final RoomInbox inbox = new RoomInbox();
    private final List<List<PlayerId>> seatChanges = new ArrayList<>();
    private final WaitingRoom room = new WaitingRoom(inbox, GameSettings.defaults(), 3, seatChanges::add);

    @Test
    void twoJoinsStartAMatch() {
        RecordingChannel c1 = new RecordingChannel("c1");
        RecordingChannel c2 = new RecordingChannel("c2");
        Envelope<ClientToServerEvent> join1 = join(c1, 1);
        Envelope<ClientToServerEvent> join2 = join(c2, 1);

        Optional<GameInstance> instance = room.run();

        assertThat(instance).isPresent();
        assertThat(instance.get().players()).containsExactly(PlayerId.of(1), PlayerId.of(2));
        assertThat(instance.get().game().isOver()).isFalse();

        JoinInfo first = new JoinInfo(new JoinedPlayerInfo.First(PlayerId.of(1)), 2);
        JoinInfo second = new JoinInfo(new JoinedPlayerInfo.Second(PlayerId.of(2), PlayerId.of(1)), 2);
        assertThat(c1.sent.get(0)).isEqualTo(
                Envelope.responseTo(join1, new ServerToClientEvent.RequestJoinAccepted(first)));
        assertThat(c1.sent.get(1).isRequest()).isTrue();
        assertThat(c1.sent.get(1).event()).isEqualTo(new ServerToClientEvent.PlayerJoined(second));
        assertThat(c2.sent).containsExactly(
                Envelope.responseTo(join2, new ServerToClientEvent.RequestJoinAccepted(second)));
        assertThat(seatChanges).containsExactly(
                List.of(PlayerId.of(1)), List.of(PlayerId.of(1), PlayerId.of(2)));
    }

    @Test
    void leavingPlayerFreesTheSeat() {
        RecordingChannel c1 = new RecordingChannel("c1");
        RecordingChannel c2 = new RecordingChannel("c2");
        RecordingChannel c3 = new RecordingChannel("c3");
        join(c1, 1);
        inbox.submit(new ServerInternalEvent.ConnectionLost(c1));
        join(c2, 1);
        join(c3, 1);

        Optional<GameInstance> instance = room.run();

        assertThat(instance).isPresent();
        assertThat(instance.get().players()).containsExactly(PlayerId.of(2), PlayerId.of(3));
        assertThat(c2.eventsOf(ServerToClientEvent.RequestJoinAccepted.class).get(0).joinInfo().joinedPlayer())
                .isEqualTo(new JoinedPlayerInfo.First(PlayerId.of(2)));
        assertThat(c1.eventsOf(ServerToClientEvent.PlayerJoined.class)).isEmpty();
    }

    @Test
    void secondJoinOnSameConnectionIsAnError() {
        RecordingChannel c1 = new RecordingChannel("c1");
        join(c1, 1);
        Envelope<ClientToServerEvent> again = join(c1, 2);
        inbox.submit(new ServerInternalEvent.Shutdown());

        Optional<GameInstance> instance = room.run();

        assertThat(instance).isEmpty();
        assertThat(c1.last()).hasValue(
                Envelope.responseTo(again, new ServerToClientEvent.ErrorMessage("already joined")));
        assertThat(seatChanges).containsExactly(List.of(PlayerId.of(1)));
    }

    @Test
    void unplayableSettingsFailBeforeAnyoneIsSeated() {
        GameSettings tooFewCards = new GameSettings(List.of(CardColor.BLACK, CardColor.WHITE), 11, 12);
        WaitingRoom badRoom = new WaitingRoom(inbox, tooFewCards, 3, seatChanges::add);
        RecordingChannel c1 = new RecordingChannel("c1");
        RecordingChannel c2 = new RecordingChannel("c2");
        join(c1, 1);
        join(c2, 1);

        assertThatThrownBy(badRoom::run)
                .isInstanceOf(GameSetupException.class)
                .hasMessageContaining("not enough cards");
        assertThat(c1.sent).isEmpty();
        assertThat(c2.sent).isEmpty();
        assertThat(seatChanges).isEmpty();
    }

    @Test
    void shutdownWhileWaitingReturnsNothing() {
        inbox.submit(new ServerInternalEvent.Shutdown());

        assertThat(room.run()).isEmpty();
    }

    @Test
    void lossOfUnseatedConnectionIsIgnored() {
        inbox.submit(new ServerInternalEvent.ConnectionLost(new RecordingChannel("ghost")));
        inbox.submit(new ServerInternalEvent.Shutdown());

        assertThat(room.run()).isEmpty();
        assertThat(seatChanges).isEmpty();
    }

    private Envelope<ClientToServerEvent> join(RecordingChannel channel, long id) {
        Envelope<ClientToServerEvent> request =
                Envelope.request(EventId.of(id), new ClientToServerEvent.RequestJoin());
        inbox.submit(new ServerInternalEvent.RequestJoin(channel, request));
        return request;
    }
}
