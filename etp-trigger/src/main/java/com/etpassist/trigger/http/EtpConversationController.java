package com.etpassist.trigger.http;

import com.etpassist.api.dto.EtpDocumentDTO;
import com.etpassist.api.dto.EtpMessageRequestDTO;
import com.etpassist.api.dto.EtpMessageResponseDTO;
import com.etpassist.api.dto.EtpSessionDTO;
import com.etpassist.api.response.Response;
import com.etpassist.trigger.application.command.EtpConversationCommandService;
import com.etpassist.trigger.application.query.EtpSessionQueryService;
import com.etpassist.types.enums.ResponseCode;
import com.etpassist.types.exception.AppException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * ETP 对话 API。
 */
@RestController
@RequestMapping("/api/v1/etp")
public class EtpConversationController {

    private final EtpConversationCommandService commandService;
    private final EtpSessionQueryService queryService;

    public EtpConversationController(EtpConversationCommandService commandService,
                                     EtpSessionQueryService queryService) {
        this.commandService = commandService;
        this.queryService = queryService;
    }

    @PostMapping("/messages")
    public Response<EtpMessageResponseDTO> sendMessage(@RequestBody EtpMessageRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求体不能为空");
        }
        EtpConversationCommandService.ProcessMessageResult result =
                commandService.processMessage(request.getSessionId(), request.getMessage());

        EtpMessageResponseDTO data = new EtpMessageResponseDTO();
        data.setSuccess(result.isSuccess());
        data.setSessionId(result.getSessionId());
        data.setAiResponse(result.getAiResponseText());
        data.setStage(result.getStage());
        data.setStateChanged(result.isStateChanged());
        data.setRequiresClarification(result.isRequiresClarification());
        data.setStructuredDelta(result.getStructuredDelta());
        return success(data);
    }

    @GetMapping("/sessions/{sessionId}")
    public Response<EtpSessionDTO> getSession(@PathVariable("sessionId") String sessionId) {
        return success(queryService.getSession(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/document")
    public Response<EtpDocumentDTO> previewDocument(@PathVariable("sessionId") String sessionId) {
        return success(queryService.previewDocument(sessionId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
