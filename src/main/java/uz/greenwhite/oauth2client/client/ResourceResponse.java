package uz.greenwhite.oauth2client.client;

import org.springframework.http.HttpHeaders;

public record ResourceResponse(int status, HttpHeaders headers, String body) {
}
