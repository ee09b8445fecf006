package com.updesk.helpdesk.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * Chat post payload. Older clients send the text under different field names, all of
 * which are accepted; the first non-blank one wins.
 */
public class ChatMessageRequest {

    @JsonAlias("message")
    private String mensagem;

    private String conteudo;

    private String texto;

    @JsonProperty("mensagem_usuario")
    private String mensagemUsuario;

    @Size(max = 255)
    private String email;

    @JsonAlias("name")
    @Size(max = 255)
    private String nome;

    public ChatMessageRequest() {
    }

    public ChatMessageRequest(String mensagem) {
        this.mensagem = mensagem;
    }

    public String resolveText() {
        for (String candidate : new String[] {mensagem, conteudo, texto, mensagemUsuario}) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.strip();
            }
        }
        return null;
    }

    public String getMensagem() {
        return mensagem;
    }

    public void setMensagem(String mensagem) {
        this.mensagem = mensagem;
    }

    public String getConteudo() {
        return conteudo;
    }

    public void setConteudo(String conteudo) {
        this.conteudo = conteudo;
    }

    public String getTexto() {
        return texto;
    }

    public void setTexto(String texto) {
        this.texto = texto;
    }

    public String getMensagemUsuario() {
        return mensagemUsuario;
    }

    public void setMensagemUsuario(String mensagemUsuario) {
        this.mensagemUsuario = mensagemUsuario;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getNome() {
        return nome;
    }

    public void setNome(String nome) {
        this.nome = nome;
    }
}
