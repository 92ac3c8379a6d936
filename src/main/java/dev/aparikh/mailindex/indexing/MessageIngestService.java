package dev.aparikh.mailindex.indexing;

import dev.aparikh.mailindex.api.IngestRequest;
import dev.aparikh.mailindex.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class MessageIngestService {

    private static final Logger log = LoggerFactory.getLogger(MessageIngestService.class);

    static final List<IngestRequest> SAMPLE_MESSAGES = List.of(
            new IngestRequest("juan@correo.com", "Reunion de equipo", "Reunion urgente mañana", "2025-11-10"),
            new IngestRequest("ana@correo.com", "Entrega de tarea", "La tarea esta lista", "2025-11-11"),
            new IngestRequest("luis@correo.com", "Proyecto nuevo", "Debemos entregar el reporte", "2025-11-09")
    );

    private final MessageIndexEngine engine;
    private final MessageFileLoader loader;

    public MessageIngestService(MessageIndexEngine engine, MessageFileLoader loader) {
        this.engine = engine;
        this.loader = loader;
    }

    public Message ingest(IngestRequest request) {
        return engine.ingest(request.sender(), request.subject(), request.body(), request.dateKey());
    }

    public List<Message> ingestAll(List<IngestRequest> requests) {
        if (requests == null || requests.isEmpty()) return List.of();
        for (int i = 0; i < requests.size(); i++) {
            IngestRequest request = requests.get(i);
            if (request == null) {
                throw new InvalidMessageException("requests[" + i + "]: request must not be null");
            }
            try {
                MessageStore.validate(request.sender(), request.dateKey());
            } catch (InvalidMessageException e) {
                throw new InvalidMessageException("requests[" + i + "]: " + e.getMessage());
            }
        }
        List<Message> created = new ArrayList<>(requests.size());
        for (IngestRequest request : requests) {
            created.add(ingest(request));
        }
        log.info("Ingested batch of {} messages", created.size());
        return created;
    }

    public MessageFileLoader.LoadReport loadFile(Path file) {
        return loader.load(file, engine);
    }

    public List<Message> preloadSamples() {
        return ingestAll(SAMPLE_MESSAGES);
    }
}
