package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;

/**
 * A reservation as seen by a caller.
 *
 * @param reservation stored reservation
 * @param effectiveStatus stored status, or EXPIRED once the window has passed before the sweep ran
 * @param replay true when the reservation already existed for the request's idempotency key
 */
public record ReservationView(Reservation reservation, ReservationStatus effectiveStatus, boolean replay) {}
