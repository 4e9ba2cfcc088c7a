package com.algohub.gameservice.games.algo.interfaces.http;

import com.algohub.gameservice.common.ApiResponse;
import com.algohub.gameservice.games.algo.application.RoomStatus;
import com.algohub.gameservice.games.algo.application.RoomSupervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 房间状态查询（只读）。
 */
@RestController
@RequestMapping("/api/room")
@RequiredArgsConstructor
public class RoomStatusController {

    private final RoomSupervisor roomSupervisor;

    /**
     * 当前阶段、已入座玩家、座位数、已完成对局数。
     */
    @GetMapping
    public ApiResponse<RoomStatus> status() {
        return ApiResponse.success(roomSupervisor.status());
    }
}
