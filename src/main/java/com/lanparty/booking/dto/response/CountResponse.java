package com.lanparty.booking.dto.response;

public record CountResponse(long count) {}
