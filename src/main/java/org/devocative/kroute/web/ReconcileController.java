package org.devocative.kroute.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.ReconcileStageException;
import org.devocative.kroute.iservice.IReconcileService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RequiredArgsConstructor
@RestController
public class ReconcileController {
	private final IReconcileService reconcileService;

	// ------------------------------

	@RequestMapping(value = "/update", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.TEXT_PLAIN_VALUE)
	public ResponseEntity<String> update() {
		final var result = reconcileService.reconcile();
		final var status = result.isFallback() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
		return ResponseEntity.status(status).body(result.getMessage());
	}

	@GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
	public String health() {
		return "ok";
	}

	@ExceptionHandler(ReconcileStageException.class)
	public ResponseEntity<String> handleStageFailure(ReconcileStageException e) {
		log.error("Reconcile Request Failed: stage=[{}]", e.getStage(), e);
		return ResponseEntity
			.status(HttpStatus.INTERNAL_SERVER_ERROR)
			.contentType(MediaType.TEXT_PLAIN)
			.body(e.getMessage());
	}
}
