package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.service.ReservationView;

/**
 * Response of a reserve call: the reservation, its price and the unsigned transaction to sign.
 *
 * @author Mint Drop Team
 */
public class MintReserveResponse {

    private ReservationDto reservation;
    private PriceBreakdown priceBreakdown;
    private String transaction;
    private boolean replay;

    public MintReserveResponse() {
    }

    public static MintReserveResponse fromView(ReservationView view) {
        Reservation reservation = view.reservation();
        MintReserveResponse response = new MintReserveResponse();
        response.setReservation(ReservationDto.fromEntity(reservation, view.effectiveStatus()));
        response.setPriceBreakdown(PriceBreakdown.fromEntity(reservation));
        response.setTransaction(reservation.getTransactionPayload());
        response.setReplay(view.replay());
        return response;
    }

    // Getters and setters
    public ReservationDto getReservation() {
        return reservation;
    }

    public void setReservation(ReservationDto reservation) {
        this.reservation = reservation;
    }

    public PriceBreakdown getPriceBreakdown() {
        return priceBreakdown;
    }

    public void setPriceBreakdown(PriceBreakdown priceBreakdown) {
        this.priceBreakdown = priceBreakdown;
    }

    public String getTransaction() {
        return transaction;
    }

    public void setTransaction(String transaction) {
        this.transaction = transaction;
    }

    public boolean isReplay() {
        return replay;
    }

    public void setReplay(boolean replay) {
        this.replay = replay;
    }
}
