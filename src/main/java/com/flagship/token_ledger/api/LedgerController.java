package com.flagship.token_ledger.api;

import com.flagship.token_ledger.api.dto.BalanceResponse;
import com.flagship.token_ledger.api.dto.BaseUnitsResponse;
import com.flagship.token_ledger.api.dto.BurnRequest;
import com.flagship.token_ledger.api.dto.ChangeOwnerRequest;
import com.flagship.token_ledger.api.dto.OwnerResponse;
import com.flagship.token_ledger.api.dto.TokenInfoResponse;
import com.flagship.token_ledger.api.dto.TransferRecordResponse;
import com.flagship.token_ledger.api.dto.TransferRequest;
import com.flagship.token_ledger.api.dto.WalletResponse;
import com.flagship.token_ledger.ledger.LedgerService;
import com.flagship.token_ledger.ledger.Principal;
import com.flagship.token_ledger.ledger.TransferRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * REST Controller for token ledger operations.
 *
 * The caller's identity is taken from the X-Caller-Principal header; it is
 * authenticated upstream and treated as an opaque identifier here.
 * Ledger rejections are mapped to HTTP responses by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LedgerController {

    public static final String CALLER_HEADER = "X-Caller-Principal";

    private final LedgerService ledgerService;

    /**
     * Creates the caller's wallet. Idempotent: an existing wallet is returned with 200.
     */
    @PostMapping("/wallets")
    public ResponseEntity<WalletResponse> createWallet(@RequestHeader(CALLER_HEADER) String caller) {
        Principal principal = Principal.of(caller);
        boolean created = ledgerService.createWallet(principal);
        WalletResponse body = new WalletResponse(principal.getId(), created, ledgerService.getBalance(principal));
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @GetMapping("/balances/{principal}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("principal") String principal) {
        Principal target = Principal.of(principal);
        return ResponseEntity.ok(new BalanceResponse(target.getId(), ledgerService.getBalance(target)));
    }

    @GetMapping("/token")
    public ResponseEntity<TokenInfoResponse> getTokenInfo() {
        return ResponseEntity.ok(TokenInfoResponse.from(ledgerService.getTokenInfo()));
    }

    /**
     * Converts a whole-token amount into base units using the token's decimals.
     */
    @GetMapping("/token/base-units")
    public ResponseEntity<BaseUnitsResponse> toBaseUnits(@RequestParam("whole") BigInteger whole) {
        BigInteger baseUnits = ledgerService.toBaseUnits(whole);
        return ResponseEntity.ok(
            new BaseUnitsResponse(whole, ledgerService.getTokenInfo().getDecimals(), baseUnits));
    }

    @GetMapping("/transfers")
    public ResponseEntity<List<TransferRecordResponse>> getTransferHistory() {
        List<TransferRecordResponse> history = ledgerService.getTransferHistory().stream()
            .map(TransferRecordResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    @PostMapping("/mint")
    public ResponseEntity<TransferRecordResponse> mint(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody TransferRequest request) {
        TransferRecord record = ledgerService.mint(
            Principal.of(caller), Principal.of(request.getRecipient()), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferRecordResponse.from(record));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferRecordResponse> transfer(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody TransferRequest request) {
        TransferRecord record = ledgerService.transfer(
            Principal.of(caller), Principal.of(request.getRecipient()), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferRecordResponse.from(record));
    }

    @PostMapping("/burn")
    public ResponseEntity<TransferRecordResponse> burn(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody BurnRequest request) {
        TransferRecord record = ledgerService.burn(Principal.of(caller), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferRecordResponse.from(record));
    }

    @GetMapping("/owner")
    public ResponseEntity<OwnerResponse> getOwner() {
        return ResponseEntity.ok(new OwnerResponse(ledgerService.getOwner().getId()));
    }

    @PutMapping("/owner")
    public ResponseEntity<OwnerResponse> changeOwner(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ChangeOwnerRequest request) {
        Principal owner = ledgerService.changeOwner(Principal.of(caller), Principal.of(request.getNewOwner()));
        return ResponseEntity.ok(new OwnerResponse(owner.getId()));
    }
}
