package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespValue;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 클라이언트 연결 하나를 처리합니다.
 * 요청을 하나씩 읽어 실행하고, 도착한 순서대로 응답을 보냅니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final Runnable onClose;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler, Runnable onClose) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = new BufferedInputStream(clientSocket.getInputStream());
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(inputStream, outputStream, clientAddress);

        } catch (EOFException e) {
            log.debug("Client disconnected: {}", clientAddress);
        } catch (RespProtocolException e) {
            // replying would desynchronize the stream, so the connection is dropped
            log.warn("Protocol error from client {}, closing connection: {}", clientAddress, e.getMessage());
        } catch (IOException e) {
            // reset, broken pipe or socket closed by stop()
            log.debug("Client {} connection ended: {}", clientAddress, e.getMessage());
        } finally {
            try {
                clientSocket.close();
            } catch (IOException e) {
                log.debug("Error closing client socket {}: {}", clientAddress, e.getMessage());
            }
            onClose.run();
        }

        log.debug("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream, String clientAddress) throws IOException {
        while (true) {
            RespValue request = RespProtocol.decode(inputStream);
            List<String> command = toCommand(request);
            if (command == null) {
                sendResponse(outputStream, RespValue.err("invalid command format"));
                continue;
            }

            if (!command.isEmpty() && "QUIT".equalsIgnoreCase(command.get(0))) {
                sendResponse(outputStream, RespValue.OK);
                log.debug("Client {} sent QUIT", clientAddress);
                return;
            }

            log.debug("Received from {}: {}", clientAddress, command);
            RespValue response;
            try {
                response = commandHandler.handleCommand(command);
            } catch (RuntimeException e) {
                log.error("Error processing command from client {}: {}", clientAddress, command, e);
                response = RespValue.err("internal server error");
            }
            sendResponse(outputStream, response);
            log.debug("Sent to {}: {}", clientAddress, response);
        }
    }

    /**
     * 요청이 bulk string 배열이면 문자열 리스트로 변환합니다. 아니면 null.
     * null 배열은 빈 명령어로 취급합니다.
     */
    private static List<String> toCommand(RespValue request) {
        if (request.getType() != RespValue.Type.ARRAY) {
            return null;
        }
        if (request.isNull()) {
            return Collections.emptyList();
        }
        List<String> command = new ArrayList<>(request.getElements().size());
        for (RespValue element : request.getElements()) {
            if (element.getType() != RespValue.Type.BULK_STRING || element.isNull()) {
                return null;
            }
            command.add(element.asString());
        }
        return command;
    }

    /**
     * 클라이언트에게 응답을 전송합니다.
     */
    private void sendResponse(OutputStream outputStream, RespValue response) throws IOException {
        RespProtocol.write(outputStream, response);
    }
}
