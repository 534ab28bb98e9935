package com.example.timesheet.client;

import com.example.timesheet.common.ApiResponse;
import com.example.timesheet.config.CacheConfig;
import com.example.timesheet.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/clients")
public class ClientController {

    private final ClientRepository clientRepository;

    public ClientController(ClientRepository clientRepository) {
        this.clientRepository = clientRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ClientDto>>> list(@RequestParam(defaultValue = "true") boolean activeOnly) {
        List<Client> clients = activeOnly ? clientRepository.findByActiveTrueOrderByNameAsc() : clientRepository.findAll();
        return ResponseEntity.ok(ApiResponse.success("Clients loaded", clients.stream().map(ClientDto::from).toList()));
    }

    @PostMapping
    @CacheEvict(cacheNames = CacheConfig.ACTIVE_CLIENTS, allEntries = true)
    public ResponseEntity<ApiResponse<ClientDto>> create(@Valid @RequestBody ClientRequest request) {
        if (clientRepository.existsByName(request.name().trim())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.failure("A client with this name already exists"));
        }
        Client saved = clientRepository.save(new Client(request.name().trim()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Client created", ClientDto.from(saved)));
    }

    @PutMapping("/{id}/active")
    @CacheEvict(cacheNames = CacheConfig.ACTIVE_CLIENTS, allEntries = true)
    public ResponseEntity<ApiResponse<ClientDto>> setActive(@PathVariable Long id, @RequestParam boolean value) {
        Client client = clientRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Client", id));
        client.setActive(value);
        return ResponseEntity.ok(ApiResponse.success("Client updated", ClientDto.from(clientRepository.save(client))));
    }

    public record ClientRequest(
            @NotBlank(message = "Client name is required")
            @Size(max = 100, message = "Client name must be at most 100 characters") String name
    ) {}

    public record ClientDto(Long id, String name, boolean active) {
        static ClientDto from(Client client) {
            return new ClientDto(client.getId(), client.getName(), client.isActive());
        }
    }
}
